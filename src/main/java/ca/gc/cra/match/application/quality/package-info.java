/**
 * Post-assignment quality diagnostics: age gaps, quality tiers and score distribution.
 */
package ca.gc.cra.match.application.quality;
