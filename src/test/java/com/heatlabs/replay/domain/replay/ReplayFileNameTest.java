package com.heatlabs.replay.domain.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ReplayFileNameTest {

  @Test
  void parsesMapModeDateAndTime() {
    ReplayFileName name = ReplayFileName.parse(
        "replay_friendshipdam_conquest_2024_05_12_18_30_05_ab12.replay").orElseThrow();

    assertEquals(new MapInfo("friendshipdam", "conquest"), name.mapInfo());
    assertEquals(Optional.of(new MatchDate(2024, 5, 12)), name.date());
    assertEquals(Optional.of(LocalTime.of(18, 30, 5)), name.time());
    assertEquals(Optional.of(LocalDateTime.of(2024, 5, 12, 18, 30, 5)), name.timestamp());
  }

  @Test
  void dateWithoutTimeSortsAtMidnight() {
    ReplayFileName name = ReplayFileName.parse("r_map_mode_2023_01_02_x.replay").orElseThrow();

    assertEquals(Optional.empty(), name.time());
    assertEquals(Optional.of(LocalDateTime.of(2023, 1, 2, 0, 0)), name.timestamp());
  }

  @Test
  void rejectsNamesWithTooFewTokens() {
    assertTrue(ReplayFileName.parse("match.replay").isEmpty());
    assertTrue(ReplayFileName.parse("r_map_mode_2023_01_02").isEmpty());
    assertTrue(ReplayFileName.parse(null).isEmpty());
  }

  @Test
  void nonNumericDateTokensKeepMapButDropDate() {
    ReplayFileName name = ReplayFileName.parse("r_map_mode_year_01_02_x.replay").orElseThrow();

    assertEquals(new MapInfo("map", "mode"), name.mapInfo());
    assertEquals(Optional.empty(), name.date());
    assertEquals(Optional.empty(), name.timestamp());
  }

  @Test
  void impossibleCalendarDatesAreKeptAsDateKeys() {
    ReplayFileName feb30 = ReplayFileName.parse(
        "05_harbor_conquest_2025_02_30_10_00_00_abcd.replay").orElseThrow();
    ReplayFileName month13 = ReplayFileName.parse("r_map_mode_2025_13_01_x.replay").orElseThrow();

    assertEquals(new MapInfo("harbor", "conquest"), feb30.mapInfo());
    assertEquals(Optional.of(new MatchDate(2025, 2, 30)), feb30.date());
    assertEquals(Optional.of(new MatchDate(2025, 13, 1)), month13.date());
    // not usable as a streak sort key
    assertEquals(Optional.empty(), feb30.timestamp());
    assertEquals(Optional.empty(), month13.timestamp());
  }

  @Test
  void matchDateOrdersByTokensAndChecksCalendar() {
    assertTrue(new MatchDate(2025, 2, 30).compareTo(new MatchDate(2025, 3, 1)) < 0);
    assertEquals("2025-02-30", new MatchDate(2025, 2, 30).toString());
    assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), new MatchDate(2024, 2, 29).toLocalDate());
    assertEquals(Optional.empty(), new MatchDate(2023, 2, 29).toLocalDate());
  }
}
