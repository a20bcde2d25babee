package ca.gc.cra.match.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableFileResolvesToRealPath() throws IOException {
    Path file = Files.writeString(tempDir.resolve("profiles.json"), "[]");

    assertEquals(file.toRealPath(), Paths.validateReadableFile("profiles", file));
  }

  @Test
  void missingOrDirectoryInputsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateReadableFile("profiles", tempDir.resolve("missing.json")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("profiles", tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("profiles", null));
  }

  @Test
  void writableFileOptionallyCreatesParents() {
    Path target = tempDir.resolve("a/b/matches.json");

    Paths.validateWritableFile("out", target, false);
    assertFalse(Files.exists(target.getParent()));

    Paths.validateWritableFile("out", target, true);
    assertTrue(Files.isDirectory(target.getParent()));
  }

  @Test
  void directoryIsNotAWritableFile() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile("out", tempDir, true));
  }
}
