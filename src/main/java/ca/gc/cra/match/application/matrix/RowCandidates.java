package ca.gc.cra.match.application.matrix;

import java.util.Arrays;

/**
 * Bounded best-first candidate list for one matrix row.
 * <p>Keeps at most {@code capacity} cells scoring at least {@code floor}, ordered by descending score
 * then ascending column. Not thread-safe; each row is filled by exactly one scoring task.</p>
 */
final class RowCandidates {
  private final int[] columns;
  private final double[] scores;
  private final double floor;
  private int size;

  RowCandidates(int capacity, double floor) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.columns = new int[capacity];
    this.scores = new double[capacity];
    this.floor = floor;
  }

  void offer(int column, double score) {
    if (score < floor) {
      return;
    }
    if (size == columns.length && !ranksBefore(score, column, scores[size - 1], columns[size - 1])) {
      return;
    }
    int position = size == columns.length ? size - 1 : size;
    while (position > 0 && ranksBefore(score, column, scores[position - 1], columns[position - 1])) {
      scores[position] = scores[position - 1];
      columns[position] = columns[position - 1];
      position--;
    }
    scores[position] = score;
    columns[position] = column;
    if (size < columns.length) {
      size++;
    }
  }

  int size() {
    return size;
  }

  int column(int index) {
    return columns[index];
  }

  double score(int index) {
    return scores[index];
  }

  /**
   * Finds the retained score for a column.
   *
   * @return the score, or {@code NaN} when the column was not retained
   */
  double find(int column) {
    for (int i = 0; i < size; i++) {
      if (columns[i] == column) {
        return scores[i];
      }
    }
    return Double.NaN;
  }

  RowCandidates trimmed() {
    if (size == columns.length) {
      return this;
    }
    RowCandidates copy = new RowCandidates(Math.max(1, size), floor);
    System.arraycopy(columns, 0, copy.columns, 0, size);
    System.arraycopy(scores, 0, copy.scores, 0, size);
    copy.size = size;
    return copy;
  }

  private static boolean ranksBefore(double score, int column, double otherScore, int otherColumn) {
    int cmp = Double.compare(score, otherScore);
    return cmp > 0 || (cmp == 0 && column < otherColumn);
  }

  @Override
  public String toString() {
    return "RowCandidates" + Arrays.toString(Arrays.copyOf(columns, size));
  }
}
