package com.heatlabs.replay.domain.replay;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata recovered from the conventional replay filename layout
 * {@code <index>_<map>_<mode>_<YYYY>_<MM>_<DD>_<hh>_<mm>_<ss>_<hash>.<ext>}.
 *
 * <p>The layout is advisory. {@link #parse(String)} succeeds for any filename with at least seven
 * underscore-delimited tokens; map and mode always come from tokens 1 and 2. The date is present when
 * tokens 3 to 5 are integers, whether or not they form a calendar date. The time of day is taken from
 * tokens 6 to 8 when a further hash token follows them.</p>
 *
 * @param fileName original filename
 * @param mapInfo map and mode tokens (positions 1 and 2)
 * @param date date tokens, when all three are integers
 * @param time optional time of day
 * @since 0.1.0
 */
public record ReplayFileName(
    String fileName, MapInfo mapInfo, Optional<MatchDate> date, Optional<LocalTime> time) {
  private static final int MIN_TOKENS = 7;
  private static final int MIN_TOKENS_WITH_TIME = 10;

  public ReplayFileName {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(mapInfo, "mapInfo");
    date = Objects.requireNonNullElse(date, Optional.empty());
    time = Objects.requireNonNullElse(time, Optional.empty());
  }

  /**
   * Parses a filename following the conventional layout.
   *
   * @param fileName base filename; {@code null} yields empty
   * @return parsed metadata, or empty when the filename has fewer than seven tokens
   */
  public static Optional<ReplayFileName> parse(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    String[] parts = fileName.split("_", -1);
    if (parts.length < MIN_TOKENS) {
      return Optional.empty();
    }
    return Optional.of(new ReplayFileName(
        fileName, new MapInfo(parts[1], parts[2]), parseDate(parts), parseTime(parts)));
  }

  /**
   * Returns the chronological sort key; undated times sort at the start of the day.
   *
   * @return match timestamp, or empty when the date tokens are missing or not a calendar date
   */
  public Optional<LocalDateTime> timestamp() {
    return date.flatMap(MatchDate::toLocalDate)
        .map(day -> day.atTime(time.orElse(LocalTime.MIDNIGHT)));
  }

  private static Optional<MatchDate> parseDate(String[] parts) {
    try {
      return Optional.of(new MatchDate(
          Integer.parseInt(parts[3]), Integer.parseInt(parts[4]), Integer.parseInt(parts[5])));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  private static Optional<LocalTime> parseTime(String[] parts) {
    if (parts.length < MIN_TOKENS_WITH_TIME) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalTime.of(
          Integer.parseInt(parts[6]), Integer.parseInt(parts[7]), Integer.parseInt(parts[8])));
    } catch (NumberFormatException | DateTimeException ex) {
      return Optional.empty();
    }
  }
}
