/**
 * Application layer orchestration for matching runs.
 * <p><strong>Role:</strong> Hosts the run state machine, the compatibility matrix, the assignment solvers and the quality analyzer.</p>
 * <p><strong>Concurrency:</strong> Matrix construction fans out over a bounded worker pool; solving and reporting are sequential.</p>
 * <p><strong>Metrics:</strong> Emits the {@code matching.*} namespace.</p>
 */
package ca.gc.cra.match.application;
