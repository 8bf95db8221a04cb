package io.sweepmesh.worker;

import io.sweepmesh.model.Credentials;

import java.nio.file.Path;

/**
 * What a worker handle is created with: the run it serves, its slot, the target and session credentials.
 */
public record WorkerContext(
        long runId,
        int slotIndex,
        String targetUrl,
        Credentials credentials,
        Path artifactsDir
) {
    public String workerId() {
        return "run-" + runId + "-worker-" + slotIndex;
    }
}
