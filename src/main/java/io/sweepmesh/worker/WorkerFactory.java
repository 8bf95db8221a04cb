package io.sweepmesh.worker;

@FunctionalInterface
public interface WorkerFactory {
    WorkerHandle create(WorkerContext context) throws Exception;
}
