package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.application.matrix.MatrixLayout;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Hand-filled matrix for solver tests.
 */
class TableMatrix implements CompatibilityMatrix {
  private final double[][] cells;
  private final MatrixLayout layout;
  private final List<Profile> profiles = new ArrayList<>();
  private final List<ClinicalRecord> records = new ArrayList<>();
  private boolean released;

  TableMatrix(MatrixLayout layout, double[][] cells, int columns) {
    this.layout = layout;
    this.cells = cells;
    for (int row = 0; row < cells.length; row++) {
      profiles.add(new Profile(String.format("p%03d", row), null, null));
    }
    for (int column = 0; column < columns; column++) {
      records.add(new ClinicalRecord(String.format("r%03d", column), null, null));
    }
  }

  static TableMatrix dense(double[][] cells) {
    return new TableMatrix(MatrixLayout.DENSE, cells, cells.length == 0 ? 0 : cells[0].length);
  }

  static TableMatrix blocked(double[][] cells) {
    return new TableMatrix(MatrixLayout.BLOCKED, cells, cells.length == 0 ? 0 : cells[0].length);
  }

  // Keeps the best k cells per row, like a blocked matrix with candidatesPerRow = k.
  static TableMatrix pruned(double[][] cells, int k) {
    return new TableMatrix(MatrixLayout.BLOCKED, cells, cells.length == 0 ? 0 : cells[0].length) {
      @Override
      public void forEachCandidate(int row, CandidateVisitor visitor) {
        List<Integer> order = new ArrayList<>();
        for (int column = 0; column < columns(); column++) {
          order.add(column);
        }
        order.sort((l, r) -> {
          int cmp = Double.compare(score(row, r), score(row, l));
          return cmp != 0 ? cmp : Integer.compare(l, r);
        });
        for (int column : order.subList(0, Math.min(k, order.size()))) {
          visitor.visit(column, score(row, column));
        }
      }
    };
  }

  static double[][] random(long seed, int rows, int columns) {
    Random random = new Random(seed);
    double[][] cells = new double[rows][columns];
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        cells[row][column] = Math.round(random.nextDouble() * 1000) / 1000.0;
      }
    }
    return cells;
  }

  @Override
  public List<Profile> profiles() {
    return profiles;
  }

  @Override
  public List<ClinicalRecord> records() {
    return records;
  }

  @Override
  public MatrixLayout layout() {
    return layout;
  }

  @Override
  public double score(int row, int column) {
    return cells[row][column];
  }

  @Override
  public void forEachCandidate(int row, CandidateVisitor visitor) {
    for (int column = 0; column < records.size(); column++) {
      visitor.visit(column, cells[row][column]);
    }
  }

  @Override
  public void release() {
    released = true;
  }

  @Override
  public boolean isReleased() {
    return released;
  }
}
