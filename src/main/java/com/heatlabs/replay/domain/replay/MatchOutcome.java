package com.heatlabs.replay.domain.replay;

/**
 * Result of a match as recorded by the game's end-of-match block.
 *
 * @since 0.1.0
 */
public enum MatchOutcome {
  /** Recorded as {@code "Win"}. */
  WIN("Win"),
  /** Recorded as {@code "Loose"} (the game's own spelling). */
  LOSS("Loose"),
  /** Anything else, including a missing value. */
  UNKNOWN("Unknown");

  private final String wireValue;

  MatchOutcome(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /**
   * Maps the raw {@code m_endGameType} value to an outcome.
   *
   * @param raw raw value; {@code null} yields {@link #UNKNOWN}
   * @return matching outcome
   */
  public static MatchOutcome fromWire(String raw) {
    if (WIN.wireValue.equals(raw)) {
      return WIN;
    }
    if (LOSS.wireValue.equals(raw)) {
      return LOSS;
    }
    return UNKNOWN;
  }
}
