package ca.gc.cra.match.application.matrix;

import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import java.util.List;

/**
 * <strong>What:</strong> Pairwise compatibility scores of one run, rows are profiles and columns records.
 * <p><strong>Why:</strong> Passed explicitly from scoring to solving so runs never share cached scores.</p>
 * <p><strong>Role:</strong> Produced by {@link MatrixBuilder}, consumed and released by the solving stage.</p>
 * <p><strong>Thread-safety:</strong> Cells are written once during construction and read-only afterwards.</p>
 *
 * <p>Rows and columns follow canonical order (ascending id), so a lower index always means a
 * lexicographically lower id. All scores lie in {@code [0, 1]}.</p>
 *
 * @since 0.1.0
 */
public interface CompatibilityMatrix {
  /**
   * Profiles in row order.
   *
   * @return immutable canonical profile list
   */
  List<Profile> profiles();

  /**
   * Records in column order.
   *
   * @return immutable canonical record list
   */
  List<ClinicalRecord> records();

  default int rows() {
    return profiles().size();
  }

  default int columns() {
    return records().size();
  }

  /**
   * Returns how cells are stored.
   *
   * @return storage layout
   */
  MatrixLayout layout();

  /**
   * Returns the composite score of a cell.
   *
   * @param row profile index
   * @param column record index
   * @return score in {@code [0, 1]}
   * @throws IndexOutOfBoundsException if an index is outside the matrix
   * @throws IllegalStateException if the matrix was released
   */
  double score(int row, int column);

  /**
   * Visits the candidate cells kept for a row. Dense matrices visit every column in ascending order;
   * blocked matrices visit their retained candidates by descending score, ties by ascending column.
   *
   * @param row profile index
   * @param visitor receives each candidate
   */
  void forEachCandidate(int row, CandidateVisitor visitor);

  /**
   * Drops cell storage once solving is finished.
   */
  void release();

  /**
   * Indicates whether {@link #release()} was called.
   *
   * @return {@code true} once released
   */
  boolean isReleased();

  /**
   * Callback for {@link #forEachCandidate(int, CandidateVisitor)}.
   */
  @FunctionalInterface
  interface CandidateVisitor {
    void visit(int column, double score);
  }
}
