/**
 * Output model of a matching run: matched pairs, quality tiers, diagnostics and the persisted artifact.
 * <p><strong>Role:</strong> Domain layer; values are created once per run and never mutated.</p>
 * <p><strong>Concurrency:</strong> Immutable records.</p>
 */
package ca.gc.cra.match.domain.match;
