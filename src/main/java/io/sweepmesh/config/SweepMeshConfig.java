package io.sweepmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SweepMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "sweepmesh-settings.json";

    private final Path rootDir;

    public SweepMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SweepMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new SweepMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("sweepmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path artifactsRoot() {
        return rootDir.resolve("artifacts");
    }

    public Path artifactsDir(long runId) {
        return artifactsRoot().resolve("run-" + runId);
    }

    public Path eventsRoot() {
        return rootDir.resolve("events");
    }

    public Path eventJournal(long runId) {
        return eventsRoot().resolve("run-" + runId + ".jsonl");
    }
}
