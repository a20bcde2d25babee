/**
 * Input model: profiles, clinical records and their optional-field schema.
 * <p><strong>Role:</strong> Domain layer; no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across scoring workers.</p>
 */
package ca.gc.cra.match.domain.model;
