/**
 * Pairwise compatibility scoring.
 * <p><strong>Role:</strong> Domain layer; pure functions of a profile, a record and the configured weights.</p>
 * <p><strong>Concurrency:</strong> Stateless after construction; shared by all scoring workers.</p>
 * <p><strong>Observability:</strong> No logging on the per-pair path; fallbacks are flagged on {@link ca.gc.cra.match.domain.scoring.CompatibilityScore}.</p>
 */
package ca.gc.cra.match.domain.scoring;
