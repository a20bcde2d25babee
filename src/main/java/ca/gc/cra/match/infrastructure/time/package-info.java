/**
 * Time source adapters implementing {@link ca.gc.cra.match.application.port.ClockPort}.
 */
package ca.gc.cra.match.infrastructure.time;
