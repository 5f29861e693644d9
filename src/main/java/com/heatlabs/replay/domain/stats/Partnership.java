package com.heatlabs.replay.domain.stats;

import java.util.Objects;

/**
 * Unordered pair of players and the number of matches they shared.
 *
 * @param first lexicographically smaller handle
 * @param second lexicographically larger handle
 * @param matches matches containing both players
 * @since 0.1.0
 */
public record Partnership(String first, String second, int matches) {
  public Partnership {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    if (first.compareTo(second) >= 0) {
      throw new IllegalArgumentException(
          "partnership handles must be distinct and ordered: " + first + ", " + second);
    }
  }
}
