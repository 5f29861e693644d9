package com.heatlabs.replay.application.stats;

import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.replay.MapInfo;
import com.heatlabs.replay.domain.replay.MatchDate;
import com.heatlabs.replay.domain.replay.MatchOutcome;
import com.heatlabs.replay.domain.replay.MatchRecord;
import com.heatlabs.replay.domain.replay.ReplayFileName;
import com.heatlabs.replay.domain.stats.CorpusProgress;
import com.heatlabs.replay.domain.stats.DateActivity;
import com.heatlabs.replay.domain.stats.MapModeStats;
import com.heatlabs.replay.domain.stats.Partnership;
import com.heatlabs.replay.domain.stats.PlayerStats;
import com.heatlabs.replay.domain.stats.PlayerSummary;
import com.heatlabs.replay.domain.stats.ResultTally;
import com.heatlabs.replay.domain.stats.StatisticsReport;
import com.heatlabs.replay.domain.stats.StreakSummary;
import com.heatlabs.replay.domain.stats.TeamSizeBucket;
import com.heatlabs.replay.domain.stats.TeamSizeDistribution;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes a {@link StatisticsReport} from a corpus snapshot.
 * <p><strong>Why:</strong> Extracted data is partial by nature; the analyzer has to turn it into
 * well-defined figures without rejecting records that lack details, players or a dated filename.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Tally results overall, per map and mode, and per player.</li>
 *   <li>Build the team-size histogram and partnership counts.</li>
 *   <li>Track win and loss streaks in chronological order.</li>
 *   <li>Summarize match dates recovered from filenames.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class StatisticsAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(StatisticsAnalyzer.class);

  private static final Comparator<PlayerStats> BY_ACTIVITY =
      Comparator.comparingInt(PlayerStats::matches).reversed()
          .thenComparing(PlayerStats::player);

  private static final Comparator<PlayerStats> BY_WIN_RATE =
      Comparator.comparingDouble(PlayerStats::winRate).reversed()
          .thenComparing(Comparator.comparingInt((PlayerStats p) -> p.tally().known()).reversed())
          .thenComparing(PlayerStats::player);

  private static final Comparator<Partnership> BY_SHARED_MATCHES =
      Comparator.comparingInt(Partnership::matches).reversed()
          .thenComparing(Partnership::first)
          .thenComparing(Partnership::second);

  private final AnalyzerSettings settings;

  public StatisticsAnalyzer() {
    this(AnalyzerSettings.defaults());
  }

  public StatisticsAnalyzer(AnalyzerSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Analyzes every record of {@code corpus}.
   *
   * @param corpus snapshot to analyze; not modified
   * @return computed report
   */
  public StatisticsReport analyze(Corpus corpus) {
    Objects.requireNonNull(corpus, "corpus");
    List<MatchRecord> records = new ArrayList<>(corpus.results().values());

    TallyCounter overall = new TallyCounter();
    Map<MapInfo, TallyCounter> byMap = new LinkedHashMap<>();
    Map<String, TallyCounter> byPlayer = new HashMap<>();
    Map<PlayerPair, Integer> pairs = new HashMap<>();
    TreeMap<Integer, Integer> teamSizes = new TreeMap<>();

    for (MatchRecord record : records) {
      MatchOutcome outcome = record.outcome();
      overall.add(outcome);
      byMap.computeIfAbsent(record.effectiveMapInfo(), key -> new TallyCounter()).add(outcome);

      List<String> players = record.players();
      teamSizes.merge(players.size(), 1, Integer::sum);
      for (int i = 0; i < players.size(); i++) {
        byPlayer.computeIfAbsent(players.get(i), key -> new TallyCounter()).add(outcome);
        for (int j = i + 1; j < players.size(); j++) {
          // players are sorted and distinct, so (i, j) is already the canonical pair order
          pairs.merge(new PlayerPair(players.get(i), players.get(j)), 1, Integer::sum);
        }
      }
    }

    StatisticsReport report = new StatisticsReport(
        new CorpusProgress(corpus.totalFiles(), corpus.processedFiles(), records.size()),
        overall.toTally(),
        mapStats(byMap),
        playerSummary(byPlayer),
        teamSizeDistribution(teamSizes, records.size()),
        topPartnerships(pairs),
        streaks(records),
        dateActivity(records));
    log.debug(
        "Analyzed {} matches ({} players, {} partnerships)",
        records.size(),
        byPlayer.size(),
        pairs.size());
    return report;
  }

  private static List<MapModeStats> mapStats(Map<MapInfo, TallyCounter> byMap) {
    List<MapModeStats> out = new ArrayList<>(byMap.size());
    byMap.forEach((mapInfo, counter) -> out.add(new MapModeStats(mapInfo, counter.toTally())));
    return out;
  }

  private PlayerSummary playerSummary(Map<String, TallyCounter> byPlayer) {
    List<PlayerStats> all = new ArrayList<>(byPlayer.size());
    byPlayer.forEach((player, counter) -> all.add(new PlayerStats(player, counter.toTally())));

    List<PlayerStats> mostActive = all.stream()
        .sorted(BY_ACTIVITY)
        .limit(settings.topActivePlayers())
        .toList();
    List<PlayerStats> bestWinRate = all.stream()
        .filter(stats -> stats.tally().known() >= settings.minQualifyingMatches())
        .sorted(BY_WIN_RATE)
        .limit(settings.topWinRatePlayers())
        .toList();
    return new PlayerSummary(all.size(), mostActive, bestWinRate, settings.minQualifyingMatches());
  }

  private static TeamSizeDistribution teamSizeDistribution(
      TreeMap<Integer, Integer> teamSizes, int matches) {
    if (matches == 0) {
      return TeamSizeDistribution.empty();
    }
    long totalPlayers = 0;
    List<TeamSizeBucket> buckets = new ArrayList<>(teamSizes.size());
    for (Map.Entry<Integer, Integer> entry : teamSizes.entrySet()) {
      int size = entry.getKey();
      int count = entry.getValue();
      totalPlayers += (long) size * count;
      buckets.add(new TeamSizeBucket(size, count, count * 100d / matches));
    }
    return new TeamSizeDistribution(
        (double) totalPlayers / matches, teamSizes.firstKey(), teamSizes.lastKey(), buckets);
  }

  private List<Partnership> topPartnerships(Map<PlayerPair, Integer> pairs) {
    return pairs.entrySet().stream()
        .map(entry -> new Partnership(entry.getKey().first(), entry.getKey().second(), entry.getValue()))
        .sorted(BY_SHARED_MATCHES)
        .limit(settings.topPartnerships())
        .toList();
  }

  /**
   * Walks results chronologically with a signed streak counter.
   *
   * <p>Records whose filename date is a calendar date come first, stable-sorted by timestamp; the rest follow in corpus
   * order. A win after losses restarts at {@code +1}, a loss after wins at {@code -1}, and an unknown
   * result resets to {@code 0}.</p>
   */
  static StreakSummary streaks(List<MatchRecord> records) {
    List<TimedRecord> dated = new ArrayList<>();
    List<MatchRecord> undated = new ArrayList<>();
    for (MatchRecord record : records) {
      Optional<LocalDateTime> timestamp =
          ReplayFileName.parse(record.fileName()).flatMap(ReplayFileName::timestamp);
      if (timestamp.isPresent()) {
        dated.add(new TimedRecord(timestamp.get(), record));
      } else {
        undated.add(record);
      }
    }
    dated.sort(Comparator.comparing(TimedRecord::timestamp));

    List<MatchRecord> ordered = new ArrayList<>(records.size());
    dated.forEach(timed -> ordered.add(timed.record()));
    ordered.addAll(undated);

    int current = 0;
    int maxWin = 0;
    int maxLoss = 0;
    for (MatchRecord record : ordered) {
      switch (record.outcome()) {
        case WIN -> {
          current = current >= 0 ? current + 1 : 1;
          maxWin = Math.max(maxWin, current);
        }
        case LOSS -> {
          current = current <= 0 ? current - 1 : -1;
          maxLoss = Math.max(maxLoss, -current);
        }
        default -> current = 0;
      }
    }
    return new StreakSummary(maxWin, maxLoss);
  }

  static DateActivity dateActivity(List<MatchRecord> records) {
    TreeMap<MatchDate, Integer> perDay = new TreeMap<>();
    int problematic = 0;
    for (MatchRecord record : records) {
      Optional<MatchDate> date =
          ReplayFileName.parse(record.fileName()).flatMap(ReplayFileName::date);
      if (date.isEmpty()) {
        problematic++;
        continue;
      }
      perDay.merge(date.get(), 1, Integer::sum);
    }

    MatchDate busiest = null;
    int busiestCount = 0;
    for (Map.Entry<MatchDate, Integer> entry : perDay.entrySet()) {
      // ascending iteration plus strict comparison keeps the earliest date on ties
      if (entry.getValue() > busiestCount) {
        busiest = entry.getKey();
        busiestCount = entry.getValue();
      }
    }
    return new DateActivity(Optional.ofNullable(busiest), busiestCount, perDay.size(), problematic);
  }

  private record PlayerPair(String first, String second) {}

  private record TimedRecord(LocalDateTime timestamp, MatchRecord record) {}

  private static final class TallyCounter {
    private int wins;
    private int losses;
    private int unknown;

    void add(MatchOutcome outcome) {
      switch (outcome) {
        case WIN -> wins++;
        case LOSS -> losses++;
        default -> unknown++;
      }
    }

    ResultTally toTally() {
      return new ResultTally(wins, losses, unknown);
    }
  }
}
