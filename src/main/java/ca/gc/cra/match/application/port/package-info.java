/**
 * <strong>Purpose:</strong> Ports defining the load -> score -> solve -> report -> persist contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate files and telemetry.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Port boundaries assume validated inputs from configuration modules.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.match.application.port;
