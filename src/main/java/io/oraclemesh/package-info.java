/**
 * OracleMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.oraclemesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.oraclemesh.cli.OracleMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.oraclemesh.runtime.OracleMeshRuntime} runs a round from extraction to rule evaluation.</li>
 *   <li>{@code io.oraclemesh.consensus.ConsensusCoordinator} is the barrier between nodes and the ledger.</li>
 * </ul>
 */
package io.oraclemesh;
