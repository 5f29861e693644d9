package com.heatlabs.replay.domain.stats;

/**
 * Win/loss/unknown counts for a group of matches.
 *
 * <p>Ratios are taken over known results only ({@code wins + losses}); with no known results both
 * ratios are {@code 0}.</p>
 *
 * @param wins matches recorded as won
 * @param losses matches recorded as lost
 * @param unknown matches without a recognised result
 * @since 0.1.0
 */
public record ResultTally(int wins, int losses, int unknown) {
  private static final ResultTally EMPTY = new ResultTally(0, 0, 0);

  public ResultTally {
    if (wins < 0 || losses < 0 || unknown < 0) {
      throw new IllegalArgumentException("tally counts must not be negative");
    }
  }

  public static ResultTally empty() {
    return EMPTY;
  }

  public int total() {
    return wins + losses + unknown;
  }

  public int known() {
    return wins + losses;
  }

  public boolean hasKnownResults() {
    return known() > 0;
  }

  /**
   * Returns {@code wins / (wins + losses)}, or {@code 0} when there are no known results.
   *
   * @return ratio in {@code [0, 1]}
   */
  public double winRatio() {
    return ratio(wins, known());
  }

  /**
   * Returns {@code losses / (wins + losses)}, or {@code 0} when there are no known results.
   *
   * @return ratio in {@code [0, 1]}
   */
  public double lossRatio() {
    return ratio(losses, known());
  }

  static double ratio(int part, int whole) {
    return whole > 0 ? (double) part / whole : 0d;
  }
}
