/**
 * Exception taxonomy for the matching engine.
 * <p><strong>Role:</strong> Domain layer; every fatal condition is a {@link ca.gc.cra.match.domain.error.MatchingException}.</p>
 * <p><strong>Observability:</strong> Messages name the offending identifier or dimension so CLI output is actionable.</p>
 */
package ca.gc.cra.match.domain.error;
