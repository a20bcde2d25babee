/**
 * Compatibility matrix storage and construction.
 * <p><strong>Role:</strong> Holds the profile x record scores handed from scoring to solving.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.match.application.matrix.MatrixBuilder} fills rows in
 * parallel; finished matrices are read-only.</p>
 * <p><strong>Performance:</strong> Dense layout for exact solving, blocked top-K layout for large pools.</p>
 */
package ca.gc.cra.match.application.matrix;
