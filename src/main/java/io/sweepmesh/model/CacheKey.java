package io.sweepmesh.model;

import io.sweepmesh.util.Jsons;

import java.util.Map;

/**
 * Identity of a reusable result: the target plus the canonical parameter mapping.
 */
public record CacheKey(long targetId, String paramsKey) {
    public CacheKey {
        if (paramsKey == null || paramsKey.isBlank()) {
            throw new IllegalArgumentException("paramsKey is required");
        }
    }

    public static CacheKey of(long targetId, Map<String, ?> params) {
        return new CacheKey(targetId, Jsons.canonicalParams(params));
    }

    public static CacheKey single(long targetId, String parameterName, Object value) {
        return of(targetId, Map.of(parameterName, value));
    }
}
