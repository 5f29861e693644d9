package com.heatlabs.replay.domain.replay;

import java.util.Objects;

/**
 * Map and game mode a match was played on.
 *
 * @param map map token
 * @param mode game mode token
 * @since 0.1.0
 */
public record MapInfo(String map, String mode) {
  /** Placeholder used when neither the record nor its filename names a map. */
  public static final MapInfo UNKNOWN = new MapInfo("unknown", "unknown");

  public MapInfo {
    Objects.requireNonNull(map, "map");
    Objects.requireNonNull(mode, "mode");
  }

  /**
   * Renders the grouping label used in reports, e.g. {@code friendshipdam (conquest)}.
   *
   * @return display label
   */
  public String label() {
    return map + " (" + mode + ")";
  }
}
