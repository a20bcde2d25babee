/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}; no logging.
 *
 * @since 0.1.0
 */
package ca.gc.cra.match.validation;
