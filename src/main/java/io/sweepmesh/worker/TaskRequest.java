package io.sweepmesh.worker;

import java.util.List;
import java.util.Map;

/**
 * One execution request: the parameter mapping plus the field instructions derived from it.
 */
public record TaskRequest(
        long runId,
        long taskId,
        int attempt,
        String targetUrl,
        Map<String, Object> params,
        List<Map<String, Object>> instructions
) {
    public TaskRequest {
        params = params == null ? Map.of() : params;
        instructions = instructions == null ? List.of() : instructions;
    }
}
