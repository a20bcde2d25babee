package ca.gc.cra.match.application.matrix;

import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import java.util.List;

/**
 * Fully materialized row-major matrix. Suitable for exact solving of small and medium pools.
 *
 * @since 0.1.0
 */
public final class DenseCompatibilityMatrix extends AbstractCompatibilityMatrix {
  private double[] cells;

  DenseCompatibilityMatrix(List<Profile> profiles, List<ClinicalRecord> records, double[] cells) {
    super(profiles, records);
    if (cells.length != (long) profiles.size() * records.size()) {
      throw new IllegalArgumentException("cell count does not match matrix shape");
    }
    this.cells = cells;
  }

  @Override
  public MatrixLayout layout() {
    return MatrixLayout.DENSE;
  }

  @Override
  public double score(int row, int column) {
    checkCell(row, column);
    return cells[row * columns() + column];
  }

  @Override
  public void forEachCandidate(int row, CandidateVisitor visitor) {
    int columns = columns();
    int offset = row * columns;
    checkRow(row);
    for (int column = 0; column < columns; column++) {
      visitor.visit(column, cells[offset + column]);
    }
  }

  @Override
  void dropCells() {
    cells = null;
  }
}
