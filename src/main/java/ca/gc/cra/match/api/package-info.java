/**
 * Command-line surface of the matching engine.
 * <p><strong>Role:</strong> Parses arguments, layers configuration, runs the matching use case and maps
 * failures to {@link ca.gc.cra.match.api.ExitCode}s.</p>
 * <p><strong>Concurrency:</strong> Single CLI thread.</p>
 */
package ca.gc.cra.match.api;
