/**
 * Runtime facade package.
 *
 * <p>{@link io.sweepmesh.runtime.SweepMeshRuntime} wires configuration, storage, parameter planning
 * and run execution together for the CLI. Executors of runs in progress are tracked by a
 * {@link io.sweepmesh.runtime.RunRegistry} so other threads can pause, resume or stop them.
 */
package io.sweepmesh.runtime;
