/**
 * Core domain model for the profile/record matching engine.
 * <p><strong>Role:</strong> Domain layer describing inputs, scoring and run outputs without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across scoring workers.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed the {@code matching.*} metric namespace.</p>
 */
package ca.gc.cra.match.domain;
