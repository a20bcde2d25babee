package ca.gc.cra.match.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Path checks run before a matching run touches the filesystem.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an input file: it must exist, be a regular file and be readable.
   *
   * @param name label used in error messages
   * @param path candidate path
   * @return normalized real path
   * @throws IllegalArgumentException when the file cannot be read
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " file " + normalized, ex);
    }
  }

  /**
   * Validates an output file target. The target may be absent but must not be a directory; its nearest
   * existing ancestor must be a writable directory. Optionally creates the parent directories.
   *
   * @param name label used in error messages
   * @param path candidate path
   * @param createParents create missing parent directories
   * @return normalized absolute path
   * @throws IllegalArgumentException when the target cannot be written
   */
  public static Path validateWritableFile(String name, Path path, boolean createParents) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " must be a file, not a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    try {
      if (createParents) {
        Files.createDirectories(parent);
      }
      Path existing = parent;
      while (existing != null && !Files.exists(existing)) {
        existing = existing.getParent();
      }
      if (existing == null || !Files.isDirectory(existing)) {
        throw new IllegalArgumentException(name + " parent is not a directory: " + parent);
      }
      if (!Files.isWritable(existing)) {
        throw new IllegalArgumentException(name + " directory is not writable: " + existing);
      }
      if (Files.exists(normalized) && !Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " file is not writable: " + normalized);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to prepare " + name + " directory " + parent + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
