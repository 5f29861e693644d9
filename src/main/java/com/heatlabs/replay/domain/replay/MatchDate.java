package com.heatlabs.replay.domain.replay;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Optional;

/**
 * Year, month and day tokens taken verbatim from a replay filename.
 *
 * <p>The tokens are not checked against the calendar: {@code 2025_02_30} is a distinct date key. Use
 * {@link #toLocalDate()} where a real calendar date is needed.</p>
 *
 * @param year year token
 * @param month month token
 * @param day day token
 * @since 0.1.0
 */
public record MatchDate(int year, int month, int day) implements Comparable<MatchDate> {
  private static final Comparator<MatchDate> ORDER = Comparator.comparingInt(MatchDate::year)
      .thenComparingInt(MatchDate::month)
      .thenComparingInt(MatchDate::day);

  /**
   * Returns the calendar date when the tokens name one.
   *
   * @return calendar date, or empty for values such as month 13 or February 30
   */
  public Optional<LocalDate> toLocalDate() {
    try {
      return Optional.of(LocalDate.of(year, month, day));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  @Override
  public int compareTo(MatchDate other) {
    return ORDER.compare(this, other);
  }

  /** Renders {@code yyyy-MM-dd}, matching {@link LocalDate#toString()} for ordinary dates. */
  @Override
  public String toString() {
    return String.format("%04d-%02d-%02d", year, month, day);
  }
}
