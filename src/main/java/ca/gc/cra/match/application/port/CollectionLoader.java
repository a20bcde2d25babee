package ca.gc.cra.match.application.port;

import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port supplying the two input collections of a matching run.
 * <p><strong>Role:</strong> Driven-side port; adapters read files produced by the upstream generators.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map raw entries onto the optional-field schema of {@link Profile} and {@link ClinicalRecord}.</li>
 *   <li>Reject collections with missing or duplicate identifiers.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface CollectionLoader {
  /**
   * Loads the profile collection in source order.
   *
   * @return immutable list of profiles
   * @throws IOException when the source cannot be read
   * @throws ca.gc.cra.match.domain.error.InvalidInputException when the content violates the schema
   */
  List<Profile> loadProfiles() throws IOException;

  /**
   * Loads the record collection in source order.
   *
   * @return immutable list of records
   * @throws IOException when the source cannot be read
   * @throws ca.gc.cra.match.domain.error.InvalidInputException when the content violates the schema
   */
  List<ClinicalRecord> loadRecords() throws IOException;
}
