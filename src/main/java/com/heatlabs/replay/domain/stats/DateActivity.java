package com.heatlabs.replay.domain.stats;

import com.heatlabs.replay.domain.replay.MatchDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Match dates recovered from filenames.
 *
 * @param mostActiveDate date with the most matches; ties resolve to the earliest date
 * @param mostActiveDateMatches matches on {@code mostActiveDate}
 * @param activeDays distinct dates with at least one match
 * @param problematicFilenames filenames with fewer than seven tokens or non-numeric date tokens
 * @since 0.1.0
 */
public record DateActivity(
    Optional<MatchDate> mostActiveDate,
    int mostActiveDateMatches,
    int activeDays,
    int problematicFilenames) {
  public DateActivity {
    mostActiveDate = Objects.requireNonNullElse(mostActiveDate, Optional.empty());
  }
}
