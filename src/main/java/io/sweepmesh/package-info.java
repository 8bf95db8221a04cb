/**
 * SweepMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sweepmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sweepmesh.cli.SweepMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.sweepmesh.runtime.SweepMeshRuntime} creates runs and hands them to executors.</li>
 *   <li>{@code io.sweepmesh.engine.RunExecutor} owns worker loops, retries, the watchdog and progress.</li>
 *   <li>{@code io.sweepmesh.storage.SweepStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.sweepmesh;
