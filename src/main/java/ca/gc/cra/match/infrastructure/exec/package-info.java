/**
 * Executor factories for the matrix scoring worker pool.
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return caller-owned executors.</p>
 */
package ca.gc.cra.match.infrastructure.exec;
