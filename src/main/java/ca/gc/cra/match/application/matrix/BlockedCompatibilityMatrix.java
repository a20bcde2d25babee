package ca.gc.cra.match.application.matrix;

import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import ca.gc.cra.match.domain.scoring.CompatibilityScorer;
import java.util.List;
import java.util.Objects;

/**
 * Sparse matrix that keeps only the best candidates of each row.
 * <p>Cells outside the retained candidates are recomputed on demand; the scorer is pure, so a lazy
 * lookup returns the same value a dense matrix would have stored.</p>
 *
 * @since 0.1.0
 */
public final class BlockedCompatibilityMatrix extends AbstractCompatibilityMatrix {
  private final CompatibilityScorer scorer;
  private RowCandidates[] rows;

  BlockedCompatibilityMatrix(
      List<Profile> profiles,
      List<ClinicalRecord> records,
      RowCandidates[] rows,
      CompatibilityScorer scorer) {
    super(profiles, records);
    if (rows.length != profiles.size()) {
      throw new IllegalArgumentException("candidate rows do not match profile count");
    }
    this.rows = rows;
    this.scorer = Objects.requireNonNull(scorer, "scorer");
  }

  @Override
  public MatrixLayout layout() {
    return MatrixLayout.BLOCKED;
  }

  @Override
  public double score(int row, int column) {
    checkCell(row, column);
    double retained = rows[row].find(column);
    if (!Double.isNaN(retained)) {
      return retained;
    }
    return scorer.composite(profiles().get(row), records().get(column));
  }

  @Override
  public void forEachCandidate(int row, CandidateVisitor visitor) {
    checkRow(row);
    RowCandidates candidates = rows[row];
    for (int i = 0; i < candidates.size(); i++) {
      visitor.visit(candidates.column(i), candidates.score(i));
    }
  }

  /**
   * Number of cells retained across all rows.
   *
   * @return retained cell count
   */
  public long retainedCells() {
    long total = 0;
    for (RowCandidates row : rows) {
      total += row.size();
    }
    return total;
  }

  @Override
  void dropCells() {
    rows = null;
  }
}
