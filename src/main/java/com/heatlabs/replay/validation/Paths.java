package com.heatlabs.replay.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration flows.
 * <p><strong>Why:</strong> Fails fast with a message naming the offending key instead of surfacing a raw
 * I/O error halfway through a batch run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require readable input directories and files.</li>
 *   <li>Require that an output file can be created or replaced.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; results can be invalidated by concurrent
 * filesystem changes.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an existing, readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, not a directory, or unreadable
   */
  public static Path requireReadableDirectory(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a file that will be created or atomically replaced, creating missing parent directories.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate output file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory or its parent cannot be written
   */
  public static Path validateOutputFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to create parent directory for " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
