package ca.gc.cra.match.infrastructure.input;

import ca.gc.cra.match.application.port.CollectionLoader;
import ca.gc.cra.match.domain.error.InvalidInputException;
import ca.gc.cra.match.domain.model.Ages;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.DemographicDimension;
import ca.gc.cra.match.domain.model.Demographics;
import ca.gc.cra.match.domain.model.Profile;
import ca.gc.cra.match.logging.Logs;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads profile and record collections from JSON array files.
 * <p><strong>Role:</strong> Adapter implementing {@link CollectionLoader} for the INIT stage.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each load parses its file afresh.</p>
 * <p><strong>Observability:</strong> DEBUG notice per missing or malformed age, INFO summary per file.</p>
 *
 * <p>Missing ids, duplicate ids, unreadable files and malformed JSON raise {@link InvalidInputException}.
 * Every other field is optional and degrades as described on the domain types: an unusable age becomes
 * {@code null}, absent demographics are excluded from scoring. Record demographics come from a
 * {@code demographics} object, or failing that from the same keys inside {@code clinical_profile}.</p>
 *
 * @since 0.1.0
 */
public final class JsonCollectionLoader implements CollectionLoader {
  private static final Logger log = LoggerFactory.getLogger(JsonCollectionLoader.class);

  private final Path profilesFile;
  private final Path recordsFile;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a loader for two files.
   *
   * @param profilesFile JSON array of profiles
   * @param recordsFile JSON array of records
   */
  public JsonCollectionLoader(Path profilesFile, Path recordsFile) {
    this.profilesFile = Objects.requireNonNull(profilesFile, "profilesFile");
    this.recordsFile = Objects.requireNonNull(recordsFile, "recordsFile");
  }

  @Override
  public List<Profile> loadProfiles() throws IOException {
    List<Map<String, Object>> items = readArray(profilesFile, "profiles");
    List<Profile> profiles = new ArrayList<>(items.size());
    Set<String> seen = new HashSet<>();
    int unknownAges = 0;
    for (int i = 0; i < items.size(); i++) {
      Map<String, Object> item = items.get(i);
      String id = requireId(item, "profile", i, seen);
      Integer age = readAge(item.get("age"), "profile", id);
      if (age == null) {
        unknownAges++;
      }
      Demographics demographics = readDemographics(asObject(item.get("demographics")));
      profiles.add(new Profile(id, age, demographics, asObject(item.get("attributes"))));
    }
    summarize("profiles", profiles.size(), unknownAges);
    return profiles;
  }

  @Override
  public List<ClinicalRecord> loadRecords() throws IOException {
    List<Map<String, Object>> items = readArray(recordsFile, "records");
    List<ClinicalRecord> records = new ArrayList<>(items.size());
    Set<String> seen = new HashSet<>();
    int unknownAges = 0;
    for (int i = 0; i < items.size(); i++) {
      Map<String, Object> item = items.get(i);
      String id = requireId(item, "record", i, seen);
      Integer age = readAge(item.get("age"), "record", id);
      if (age == null) {
        unknownAges++;
      }
      Map<String, Object> clinicalProfile = asObject(item.get("clinical_profile"));
      Map<String, Object> demographicSource = item.get("demographics") instanceof Map<?, ?>
          ? asObject(item.get("demographics"))
          : clinicalProfile;
      records.add(new ClinicalRecord(
          id,
          age,
          readConditions(item.get("conditions")),
          clinicalProfile,
          readDemographics(demographicSource)));
    }
    summarize("records", records.size(), unknownAges);
    return records;
  }

  private List<Map<String, Object>> readArray(Path file, String kind) throws IOException {
    if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
      throw new InvalidInputException(kind + " file is missing or unreadable: " + file);
    }
    Object root;
    try {
      root = json.parse(file);
    } catch (IllegalArgumentException ex) {
      throw new InvalidInputException("malformed " + kind + " file " + file + ": " + ex.getMessage(), ex);
    }
    if (!(root instanceof List<?> list)) {
      throw new InvalidInputException(kind + " file " + file + " must contain a JSON array");
    }
    List<Map<String, Object>> items = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); i++) {
      if (!(list.get(i) instanceof Map<?, ?>)) {
        throw new InvalidInputException(kind + " entry #" + i + " in " + file + " is not a JSON object");
      }
      items.add(asObject(list.get(i)));
    }
    return items;
  }

  private static String requireId(Map<String, Object> item, String kind, int index, Set<String> seen) {
    Object raw = item.get("id");
    String id = raw instanceof String || raw instanceof Number ? String.valueOf(raw).trim() : null;
    if (id == null || id.isEmpty()) {
      throw new InvalidInputException(kind + " entry #" + index + " has no usable id");
    }
    if (!seen.add(id)) {
      throw new InvalidInputException("duplicate " + kind + " id: " + Logs.quote(id));
    }
    return id;
  }

  static Integer readAge(Object raw, String kind, String id) {
    Integer age = parseAge(raw);
    if (age != null && !Ages.isPlausible(age)) {
      age = null;
    }
    if (age == null && log.isDebugEnabled()) {
      log.debug("{} {} has unusable age {}; age scores neutral", kind, id, Logs.quote(raw));
    }
    return age;
  }

  private static Integer parseAge(Object raw) {
    BigDecimal value;
    String text;
    if (raw instanceof Double || raw instanceof Float) {
      double number = ((Number) raw).doubleValue();
      if (!Double.isFinite(number)) {
        // Overflowing literals such as 1e400 arrive as infinity.
        return null;
      }
      text = raw.toString();
    } else if (raw instanceof Number number) {
      text = number.toString();
    } else if (raw instanceof String string && !string.isBlank()) {
      text = string.trim();
    } else {
      return null;
    }
    try {
      value = new BigDecimal(text);
    } catch (NumberFormatException ex) {
      return null;
    }
    try {
      return value.intValueExact();
    } catch (ArithmeticException ex) {
      // Fractional or out of int range.
      return null;
    }
  }

  private static Demographics readDemographics(Map<String, Object> source) {
    if (source.isEmpty()) {
      return Demographics.empty();
    }
    return new Demographics(
        text(source.get(DemographicDimension.EDUCATION.wireName())),
        text(source.get(DemographicDimension.OCCUPATION_CATEGORY.wireName())),
        text(source.get(DemographicDimension.INCOME_BRACKET.wireName())),
        text(source.get(DemographicDimension.MARITAL_STATUS.wireName())));
  }

  private static List<String> readConditions(Object raw) {
    if (!(raw instanceof List<?> list)) {
      return List.of();
    }
    List<String> codes = new ArrayList<>(list.size());
    for (Object code : list) {
      if (code instanceof String || code instanceof Number) {
        codes.add(String.valueOf(code));
      }
    }
    return codes;
  }

  private static String text(Object raw) {
    return raw instanceof String s ? s : null;
  }

  private static Map<String, Object> asObject(Object raw) {
    if (!(raw instanceof Map<?, ?> map)) {
      return Map.of();
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      fields.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return fields;
  }

  private static void summarize(String kind, int count, int unknownAges) {
    if (unknownAges > 0) {
      log.info("Loaded {} {}; {} without a usable age will score neutral on age", count, kind, unknownAges);
    } else {
      log.info("Loaded {} {}", count, kind);
    }
  }
}
