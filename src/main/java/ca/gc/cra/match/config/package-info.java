/**
 * Configuration loading, layering and dependency wiring.
 * <p><strong>Role:</strong> Turns defaults, an optional YAML file and CLI arguments into a validated
 * {@link ca.gc.cra.match.config.MatchConfig} and wires the run through
 * {@link ca.gc.cra.match.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Used on the CLI thread during bootstrap.</p>
 */
package ca.gc.cra.match.config;
