package com.heatlabs.replay.domain.replay;

import com.heatlabs.replay.domain.json.JsonValue;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Everything extracted from one replay file, keyed by filename in the corpus.
 * <p><strong>Why:</strong> Forms the unit of incremental corpus updates; reprocessing a file replaces its record.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are defensively copied.</p>
 *
 * @param fileName base filename of the replay
 * @param matchDetails decoded segment objects in scan order (loaded corpora may hold other JSON shapes)
 * @param gameVersion build and branch strings
 * @param players player handles, sorted and deduplicated
 * @param mapInfo map and mode derived from the filename, when it has at least seven tokens
 * @param error failure description when the file could not be read; other fields are then empty
 * @since 0.1.0
 */
public record MatchRecord(
    String fileName,
    List<JsonValue> matchDetails,
    BuildInfo gameVersion,
    List<String> players,
    Optional<MapInfo> mapInfo,
    Optional<String> error) {
  /** Error text recorded when an input file vanished between discovery and processing. */
  public static final String FILE_NOT_FOUND = "File not found";

  public MatchRecord {
    Objects.requireNonNull(fileName, "fileName");
    matchDetails = matchDetails == null ? List.of() : List.copyOf(matchDetails);
    gameVersion = Objects.requireNonNullElse(gameVersion, BuildInfo.empty());
    players = players == null ? List.of() : List.copyOf(new TreeSet<>(players));
    mapInfo = Objects.requireNonNullElse(mapInfo, Optional.empty());
    error = Objects.requireNonNullElse(error, Optional.empty());
  }

  /**
   * Builds the record for a successfully scanned replay.
   *
   * @param fileName base filename
   * @param segments segments in scan order
   * @param gameVersion extracted build info
   * @param players extracted player handles
   * @return populated record
   */
  public static MatchRecord extracted(
      String fileName, List<Segment> segments, BuildInfo gameVersion, Collection<String> players) {
    List<JsonValue> details = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      details.add(segment.value());
    }
    return new MatchRecord(
        fileName,
        details,
        gameVersion,
        new ArrayList<>(players),
        ReplayFileName.parse(fileName).map(ReplayFileName::mapInfo),
        Optional.empty());
  }

  /**
   * Builds the placeholder record for a file that could not be processed.
   *
   * @param fileName base filename
   * @param error failure description
   * @return error record
   */
  public static MatchRecord failed(String fileName, String error) {
    return new MatchRecord(
        fileName, List.of(), BuildInfo.empty(), List.of(), Optional.empty(), Optional.of(error));
  }

  public boolean isFailed() {
    return error.isPresent();
  }

  /**
   * Reads the match result from the first detail object.
   *
   * <p>The end-of-match block nests the value under {@code details.m_endGameType}; a top-level
   * {@code m_endGameType} is accepted as well.</p>
   *
   * @return outcome, {@link MatchOutcome#UNKNOWN} when absent
   */
  public MatchOutcome outcome() {
    if (matchDetails.isEmpty() || !(matchDetails.get(0) instanceof JsonObject first)) {
      return MatchOutcome.UNKNOWN;
    }
    Optional<String> raw = first.path("details", "m_endGameType").flatMap(JsonValue::asText);
    if (raw.isEmpty()) {
      raw = first.path("m_endGameType").flatMap(JsonValue::asText);
    }
    return MatchOutcome.fromWire(raw.orElse(null));
  }

  /**
   * Resolves the map grouping for reports.
   *
   * @return stored map info, else the filename-derived one, else {@link MapInfo#UNKNOWN}
   */
  public MapInfo effectiveMapInfo() {
    return mapInfo.or(() -> ReplayFileName.parse(fileName).map(ReplayFileName::mapInfo))
        .orElse(MapInfo.UNKNOWN);
  }
}
