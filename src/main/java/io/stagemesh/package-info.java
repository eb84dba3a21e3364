/**
 * StageMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.stagemesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.stagemesh.cli.StageMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.stagemesh.engine.ExecutionEngine} runs waves, retries, timeouts and resume.</li>
 *   <li>{@code io.stagemesh.storage.SessionRepository} is the lock-guarded session persistence layer.</li>
 * </ul>
 */
package io.stagemesh;
