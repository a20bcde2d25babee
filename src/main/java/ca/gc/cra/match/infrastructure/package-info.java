/**
 * Infrastructure adapters: JSON input and output, metrics export, executors and time.
 */
package ca.gc.cra.match.infrastructure;
