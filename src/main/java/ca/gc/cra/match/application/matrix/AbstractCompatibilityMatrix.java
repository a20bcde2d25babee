package ca.gc.cra.match.application.matrix;

import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import java.util.List;
import java.util.Objects;

/**
 * Shared bookkeeping for matrix implementations: canonical inputs, bounds checks and release state.
 */
abstract class AbstractCompatibilityMatrix implements CompatibilityMatrix {
  private final List<Profile> profiles;
  private final List<ClinicalRecord> records;
  private volatile boolean released;

  AbstractCompatibilityMatrix(List<Profile> profiles, List<ClinicalRecord> records) {
    this.profiles = List.copyOf(Objects.requireNonNull(profiles, "profiles"));
    this.records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  @Override
  public final List<Profile> profiles() {
    return profiles;
  }

  @Override
  public final List<ClinicalRecord> records() {
    return records;
  }

  @Override
  public final void release() {
    released = true;
    dropCells();
  }

  @Override
  public final boolean isReleased() {
    return released;
  }

  abstract void dropCells();

  final void checkCell(int row, int column) {
    checkRow(row);
    Objects.checkIndex(column, records.size());
  }

  final void checkRow(int row) {
    if (released) {
      throw new IllegalStateException("compatibility matrix already released");
    }
    Objects.checkIndex(row, profiles.size());
  }
}
