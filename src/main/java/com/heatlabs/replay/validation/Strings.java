package com.heatlabs.replay.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings taken from the CLI and YAML configuration.
 * <p><strong>Why:</strong> Rejects blank or control-character values before they reach the filesystem or
 * the extension filter.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; failures raise {@link IllegalArgumentException}
 * naming the offending key.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final int MAX_EXTENSION_LENGTH = 32;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Normalizes a file extension filter to a lower-case value with a leading dot.
   *
   * <p>{@code "REPLAY"} and {@code ".Replay"} both become {@code ".replay"}.</p>
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate extension
   * @return normalized extension
   * @throws IllegalArgumentException if the value is blank, too long, or contains separators or
   *     non-printable characters
   */
  public static String requireExtension(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    String normalized = (trimmed.startsWith(".") ? trimmed : "." + trimmed).toLowerCase(Locale.ROOT);
    if (normalized.length() < 2 || normalized.length() > MAX_EXTENSION_LENGTH) {
      throw new IllegalArgumentException(
          message(name, "length must be between 1 and " + (MAX_EXTENSION_LENGTH - 1)));
    }
    for (int i = 1; i < normalized.length(); i++) {
      char c = normalized.charAt(i);
      if (c <= 0x20 || c > 0x7E || c == '/' || c == '\\') {
        throw new IllegalArgumentException(
            message(name, "must contain printable ASCII without separators"));
      }
    }
    return normalized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
