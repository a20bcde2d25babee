/**
 * Matching run lifecycle.
 * <p><strong>Role:</strong> Use case that drives a run through its stages and maps failures to the
 * stage they occurred in.</p>
 * <p><strong>Concurrency:</strong> Runs are single-threaded apart from parallel matrix scoring.</p>
 * <p><strong>Observability:</strong> Emits {@code matching.run.*} and {@code matching.stage.*} metrics.</p>
 */
package ca.gc.cra.match.application.pipeline;
