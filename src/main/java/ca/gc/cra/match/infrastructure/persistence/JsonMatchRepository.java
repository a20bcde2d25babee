package ca.gc.cra.match.infrastructure.persistence;

import ca.gc.cra.match.application.port.MatchRepository;
import ca.gc.cra.match.domain.match.MatchArtifact;
import ca.gc.cra.match.domain.match.MatchResult;
import ca.gc.cra.match.domain.match.MatchedPair;
import ca.gc.cra.match.domain.match.QualityTier;
import ca.gc.cra.match.domain.match.RunDiagnostics;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Persists a {@link MatchArtifact} as a pretty-printed JSON document.
 * <p><strong>Why:</strong> Downstream consumers must never observe a half-written artifact.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link MatchRepository} for the PERSISTING stage.</p>
 * <p><strong>Thread-safety:</strong> Single writer per target file; concurrent runs must use distinct targets.</p>
 *
 * <p>The document is written to a temporary sibling, forced to disk, then moved over the target with
 * {@code ATOMIC_MOVE}. Filesystems without atomic rename fall back to a plain replacing move. On any
 * failure the temporary file is deleted and the previous artifact is left as it was. Output for identical
 * inputs differs only in {@code run_timestamp}.</p>
 * <p>On POSIX filesystems the new file takes the permissions of the artifact it replaces, or
 * {@code rw-r--r--} on a first write.</p>
 *
 * @since 0.1.0
 */
public final class JsonMatchRepository implements MatchRepository {
  private static final Logger log = LoggerFactory.getLogger(JsonMatchRepository.class);

  static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

  private final Path target;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a repository writing to a single file.
   *
   * @param target artifact path; parent directories are created on save
   */
  public JsonMatchRepository(Path target) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath().normalize();
  }

  @Override
  public String location() {
    return target.toString();
  }

  @Override
  public void save(MatchArtifact artifact) throws IOException {
    Objects.requireNonNull(artifact, "artifact");
    Path directory = target.getParent();
    Files.createDirectories(directory);
    Path temp = Files.createTempFile(directory, "." + target.getFileName() + ".", ".tmp");
    boolean moved = false;
    try {
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE);
           OutputStream out = Channels.newOutputStream(channel)) {
        try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
          gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
          gen.useDefaultPrettyPrinter();
          write(gen, artifact);
        }
        out.write('\n');
        out.flush();
        channel.force(true);
      }
      applyPermissions(temp);
      move(temp);
      moved = true;
      log.debug("Artifact committed to {}", target);
    } finally {
      if (!moved) {
        deleteQuietly(temp);
      }
    }
  }

  // Temp files start owner-only; keep the previous artifact's mode, else rw-r--r--.
  private void applyPermissions(Path temp) throws IOException {
    PosixFileAttributeView view = Files.getFileAttributeView(temp, PosixFileAttributeView.class);
    if (view == null) {
      return;
    }
    Set<PosixFilePermission> permissions = Files.exists(target)
        ? Files.getPosixFilePermissions(target)
        : DEFAULT_PERMISSIONS;
    view.setPermissions(permissions);
  }

  private void move(Path temp) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.warn("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException cleanup) {
      log.warn("Unable to delete temporary artifact {}", temp, cleanup);
    }
  }

  private static void write(JsonGenerator gen, MatchArtifact artifact) throws IOException {
    MatchResult result = artifact.result();
    gen.writeStartObject();
    gen.writeStringField("run_timestamp", artifact.runTimestamp().toString());
    gen.writeStringField("solver_mode", result.solverMode().name());
    gen.writeArrayFieldStart("pairs");
    for (MatchedPair pair : result.pairs()) {
      writePair(gen, pair);
    }
    gen.writeEndArray();
    writeIds(gen, "unmatched_profiles", result.unmatchedProfiles());
    writeIds(gen, "unmatched_records", result.unmatchedRecords());
    writeDiagnostics(gen, artifact.diagnostics());
    gen.writeEndObject();
  }

  private static void writePair(JsonGenerator gen, MatchedPair pair) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("profile_id", pair.profileId());
    gen.writeStringField("record_id", pair.recordId());
    gen.writeNumberField("score", pair.score());
    gen.writeObjectFieldStart("sub_scores");
    gen.writeNumberField("age", pair.ageScore());
    gen.writeNumberField("socio", pair.socioScore());
    gen.writeEndObject();
    gen.writeStringField("quality_tier", pair.tier().label());
    writeNullable(gen, "age_gap", pair.ageGap());
    gen.writeEndObject();
  }

  private static void writeIds(JsonGenerator gen, String field, List<String> ids) throws IOException {
    gen.writeArrayFieldStart(field);
    for (String id : ids) {
      gen.writeString(id);
    }
    gen.writeEndArray();
  }

  private static void writeDiagnostics(JsonGenerator gen, RunDiagnostics d) throws IOException {
    gen.writeObjectFieldStart("diagnostics");
    gen.writeNumberField("pair_count", d.pairCount());
    gen.writeBooleanField("no_data", d.noData());
    writeNullable(gen, "mean_gap", d.meanGap());
    writeNullable(gen, "median_gap", d.medianGap());
    writeNullable(gen, "within_2_years", d.within2Years());
    writeNullable(gen, "within_5_years", d.within5Years());
    gen.writeObjectFieldStart("tier_counts");
    for (QualityTier tier : QualityTier.values()) {
      gen.writeNumberField(tier.label(), d.count(tier));
    }
    gen.writeEndObject();
    writeNullable(gen, "quality_index", d.qualityIndex());
    gen.writeNumberField("total_score", d.totalScore());
    writeNullable(gen, "score_min", d.scoreMin());
    writeNullable(gen, "score_max", d.scoreMax());
    writeNullable(gen, "score_median", d.scoreMedian());
    writeNullable(gen, "score_std_dev", d.scoreStdDev());
    gen.writeObjectFieldStart("sub_score_means");
    writeNullable(gen, "age", d.meanAgeScore());
    writeNullable(gen, "socio", d.meanSocioScore());
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeNullable(JsonGenerator gen, String field, Number value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else if (value instanceof Integer i) {
      gen.writeNumberField(field, i);
    } else {
      gen.writeNumberField(field, value.doubleValue());
    }
  }
}
