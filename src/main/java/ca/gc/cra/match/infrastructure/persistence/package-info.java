/**
 * Artifact persistence adapters.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.match.application.port.MatchRepository} with atomic
 * JSON file replacement.</p>
 * <p><strong>Concurrency:</strong> One writer per target file.</p>
 */
package ca.gc.cra.match.infrastructure.persistence;
