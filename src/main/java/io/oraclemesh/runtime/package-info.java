/**
 * Runtime orchestration package.
 *
 * <p>{@link io.oraclemesh.runtime.OracleMeshRuntime} owns the round: extraction,
 * concurrent attestation, consensus, human fallback, ledger commitment, record
 * persistence, rule evaluation and the audit trail around them.
 */
package io.oraclemesh.runtime;
