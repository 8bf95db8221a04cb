package io.sweepmesh.model;

import java.util.Map;

public record Credentials(String email, String password) {
    public static final String ENV_EMAIL = "SWEEPMESH_EMAIL";
    public static final String ENV_PASSWORD = "SWEEPMESH_PASSWORD";

    public static Credentials fromEnv(Map<String, String> env) {
        return new Credentials(env.getOrDefault(ENV_EMAIL, ""), env.getOrDefault(ENV_PASSWORD, ""));
    }

    @Override
    public String toString() {
        return "Credentials[email=" + email + ", password=***]";
    }
}
