package org.lofarimaging.realtime.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for the stream input directory, the images root and the
 * calibration table directory.
 * <p><strong>Thread-safety:</strong> Stateless; the filesystem may change between a check and later use.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, creating it and its parents when missing.
   *
   * @param name parameter name used in diagnostics
   * @param path candidate directory
   * @return the absolute, normalized, real directory path
   * @throws IllegalArgumentException if the path is malformed, is not a directory, is not writable or cannot be
   *     created
   */
  public static Path validateWritableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(label(name) + " is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException(label(name) + " is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to prepare " + label(name) + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that an existing directory is readable.
   *
   * @param name parameter name used in diagnostics
   * @param path candidate directory
   * @return the absolute, normalized directory path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path validateReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(label(name) + " does not exist or is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(label(name) + " is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(label(name) + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "path" : name;
  }
}
