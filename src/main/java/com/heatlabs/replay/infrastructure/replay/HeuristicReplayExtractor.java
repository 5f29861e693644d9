package com.heatlabs.replay.infrastructure.replay;

import com.heatlabs.replay.application.port.ReplayExtractor;
import com.heatlabs.replay.domain.replay.BuildInfo;
import com.heatlabs.replay.domain.replay.MatchRecord;
import com.heatlabs.replay.domain.replay.Segment;
import com.heatlabs.replay.domain.scan.JsonSegmentScanner;
import com.heatlabs.replay.domain.scan.MetadataExtractor;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ReplayExtractor} combining the segment scanner and the metadata extractor.
 * <p><strong>Why:</strong> Both heuristics read the same bytes independently; this adapter merges their
 * output into one {@link MatchRecord}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; shared by all workers.</p>
 *
 * @since 0.1.0
 */
public final class HeuristicReplayExtractor implements ReplayExtractor {
  private static final Logger log = LoggerFactory.getLogger(HeuristicReplayExtractor.class);

  private final JsonSegmentScanner scanner;
  private final MetadataExtractor metadata;

  public HeuristicReplayExtractor() {
    this(new JsonSegmentScanner(), new MetadataExtractor());
  }

  public HeuristicReplayExtractor(JsonSegmentScanner scanner, MetadataExtractor metadata) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
  }

  @Override
  public MatchRecord extract(String fileName, byte[] content) {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(content, "content");
    List<Segment> segments = scanner.scan(content);
    BuildInfo buildInfo = metadata.extractBuildInfo(content);
    SortedSet<String> players = metadata.extractPlayerNames(content);
    if (log.isDebugEnabled()) {
      log.debug(
          "Extracted {} segments, {} players, build={} from {} bytes",
          segments.size(),
          players.size(),
          buildInfo.build().orElse("?"),
          content.length);
    }
    return MatchRecord.extracted(fileName, segments, buildInfo, players);
  }
}
