/**
 * Assignment strategies over a compatibility matrix: exact Hungarian, greedy with repair, and the
 * row-greedy baseline, plus mode selection and post-solve validation.
 */
package ca.gc.cra.match.application.solver;
