package com.heatlabs.replay.domain.scan;

import com.heatlabs.replay.domain.replay.BuildInfo;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pulls build strings and player handles out of raw replay bytes.
 *
 * <p>Build info is found by fixed prefixes ({@code build: '} and {@code branch: '}) in a lossy UTF-8
 * view of the buffer. Player handles are {@code \b\w{3,20}#[0-9]{3,6}\b} with ASCII word characters and
 * ASCII word boundaries; they are located by a hand-written scanner over word runs so the cost stays
 * linear and no regex engine is involved.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MetadataExtractor {
  static final String BUILD_PREFIX = "build: '";
  static final String BRANCH_PREFIX = "branch: '";

  private static final int MIN_NAME = 3;
  private static final int MAX_NAME = 20;
  private static final int MIN_DIGITS = 3;
  private static final int MAX_DIGITS = 6;
  private static final byte HASH = '#';

  /**
   * Extracts the build and branch strings.
   *
   * @param buffer raw replay bytes
   * @return build info; each field is empty when its prefix or closing quote is missing
   */
  public BuildInfo extractBuildInfo(byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer");
    String text = new String(buffer, StandardCharsets.UTF_8);
    return new BuildInfo(quoted(text, BUILD_PREFIX), quoted(text, BRANCH_PREFIX));
  }

  /**
   * Extracts every player handle, deduplicated and sorted lexicographically.
   *
   * @param buffer raw replay bytes
   * @return sorted handles
   */
  public SortedSet<String> extractPlayerNames(byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer");
    SortedSet<String> names = new TreeSet<>();
    for (int[] match : findHandles(buffer)) {
      names.add(new String(buffer, match[0], match[1] - match[0], StandardCharsets.UTF_8));
    }
    return names;
  }

  /**
   * Returns {@code [start, end)} pairs of non-overlapping handle matches in buffer order.
   *
   * <p>A handle can only start at a word boundary, i.e. at the first byte of a maximal run of word
   * bytes. Because {@code '#'} is not a word byte the name part must be that whole run, so each run is
   * tested once: its length must fit the name bounds, it must be followed by {@code '#'}, then by a
   * maximal digit run of allowed length that is not directly followed by another word byte.</p>
   */
  static List<int[]> findHandles(byte[] buffer) {
    List<int[]> matches = new ArrayList<>();
    int n = buffer.length;
    int i = 0;
    while (i < n) {
      if (!isWord(buffer[i])) {
        i++;
        continue;
      }
      int runEnd = i;
      while (runEnd < n && isWord(buffer[runEnd])) {
        runEnd++;
      }
      int nameLength = runEnd - i;
      if (nameLength >= MIN_NAME && nameLength <= MAX_NAME
          && runEnd < n && buffer[runEnd] == HASH) {
        int digitsStart = runEnd + 1;
        int digitsEnd = digitsStart;
        while (digitsEnd < n && isDigit(buffer[digitsEnd])) {
          digitsEnd++;
        }
        int digits = digitsEnd - digitsStart;
        // \b after the digits: next byte must not be a word byte (letters or underscore included).
        boolean boundary = digitsEnd == n || !isWord(buffer[digitsEnd]);
        if (digits >= MIN_DIGITS && digits <= MAX_DIGITS && boundary) {
          matches.add(new int[] {i, digitsEnd});
          i = digitsEnd;
          continue;
        }
      }
      i = runEnd;
    }
    return matches;
  }

  private static Optional<String> quoted(String text, String prefix) {
    int start = text.indexOf(prefix);
    if (start < 0) {
      return Optional.empty();
    }
    int valueStart = start + prefix.length();
    int end = text.indexOf('\'', valueStart);
    if (end < 0) {
      return Optional.empty();
    }
    return Optional.of(text.substring(valueStart, end));
  }

  private static boolean isWord(byte b) {
    return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || isDigit(b) || b == '_';
  }

  private static boolean isDigit(byte b) {
    return b >= '0' && b <= '9';
  }
}
