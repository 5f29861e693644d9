package com.heatlabs.replay.domain.replay;

import java.util.Objects;
import java.util.Optional;

/**
 * Game build and branch strings found in a replay, each independently optional.
 *
 * @param build build identifier
 * @param branch source branch name
 * @since 0.1.0
 */
public record BuildInfo(Optional<String> build, Optional<String> branch) {
  private static final BuildInfo EMPTY = new BuildInfo(Optional.empty(), Optional.empty());

  public BuildInfo {
    build = Objects.requireNonNullElse(build, Optional.empty());
    branch = Objects.requireNonNullElse(branch, Optional.empty());
  }

  public static BuildInfo empty() {
    return EMPTY;
  }

  public static BuildInfo of(String build, String branch) {
    return new BuildInfo(Optional.ofNullable(build), Optional.ofNullable(branch));
  }
}
