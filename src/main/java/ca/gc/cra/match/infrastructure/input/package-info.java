/**
 * JSON input adapters for the profile and record collections.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.match.application.port.CollectionLoader} with Jackson streaming.</p>
 */
package ca.gc.cra.match.infrastructure.input;
