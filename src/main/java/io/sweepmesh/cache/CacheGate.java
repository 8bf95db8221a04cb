package io.sweepmesh.cache;

import io.sweepmesh.model.CacheKey;
import io.sweepmesh.model.ResultRecord;
import io.sweepmesh.storage.StoreException;
import io.sweepmesh.storage.SweepStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Serves a task from an earlier completed task of the same target with the same parameters, without
 * invoking a worker.
 */
public final class CacheGate {
    private static final Logger log = LoggerFactory.getLogger(CacheGate.class);

    private final SweepStore store;

    public CacheGate(SweepStore store) {
        this.store = store;
    }

    /**
     * Completes {@code taskId} from cache when possible and returns the source result. A failed lookup
     * counts as a miss; a failed write propagates.
     */
    public Optional<ResultRecord> tryServe(long targetId, long taskId, Map<String, Object> params,
                                           boolean skipCache, long nowMs) {
        if (skipCache) {
            return Optional.empty();
        }
        Optional<ResultRecord> cached;
        try {
            cached = store.findCachedResult(CacheKey.of(targetId, params));
        } catch (StoreException e) {
            log.warn("Cache lookup failed for task {}, executing it instead", taskId, e);
            return Optional.empty();
        }
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        ResultRecord source = cached.get();
        if (source.taskId() == taskId) {
            return Optional.empty();
        }
        if (!store.completeFromCache(taskId, source, nowMs)) {
            log.warn("Task {} was no longer pending, cache result from task {} not applied", taskId, source.taskId());
            return Optional.empty();
        }
        log.debug("Task {} served from cached result of task {}", taskId, source.taskId());
        return Optional.of(source);
    }
}
