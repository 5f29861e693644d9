package com.heatlabs.replay.domain.scan;

import com.heatlabs.replay.domain.json.JsonCodec;
import com.heatlabs.replay.domain.json.JsonValue;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import com.heatlabs.replay.domain.replay.Segment;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Heuristic scanner that recovers embedded JSON objects from opaque replay bytes.
 * <p><strong>Why:</strong> The replay container is undocumented; its readable match data is stored as plain
 * JSON objects between binary sections.</p>
 * <p><strong>Policy:</strong> For every {@code '{'} at index {@code i}, candidate ends {@code j} are tried in
 * increasing order inside {@code [i + MIN_LOOKAHEAD, min(i + WINDOW, length))}. The first {@code j} where
 * {@code buffer[j] == '}'} and {@code buffer[i..j]} is valid UTF-8 holding a JSON object wins. Scanning
 * then resumes at {@code i + 1}, so nested or overlapping objects may be reported again.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share across worker threads.</p>
 * <p><strong>Performance:</strong> At most {@link #WINDOW} bytes are examined per opening brace, keeping the
 * scan linear in the buffer size. Candidates past the first malformed UTF-8 byte are skipped without
 * parsing.</p>
 *
 * @since 0.1.0
 */
public final class JsonSegmentScanner {
  /** Smallest distance between an opening brace and a candidate closing brace. */
  public static final int MIN_LOOKAHEAD = 10;
  /** Exclusive upper bound on the distance between an opening brace and a candidate closing brace. */
  public static final int WINDOW = 5_000;

  private static final byte OPEN = '{';
  private static final byte CLOSE = '}';

  /**
   * Scans {@code buffer} for embedded JSON objects.
   *
   * @param buffer raw replay bytes; never {@code null}
   * @return segments ordered by start offset
   */
  public List<Segment> scan(byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer");
    List<Segment> segments = new ArrayList<>();
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    CharBuffer scratch = CharBuffer.allocate(WINDOW);
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] != OPEN) {
        continue;
      }
      int windowEnd = Math.min(i + WINDOW, buffer.length);
      int firstFrom = i + MIN_LOOKAHEAD;
      if (firstFrom >= windowEnd) {
        continue;
      }
      int validEnd = validUtf8End(decoder, scratch, buffer, i, windowEnd);
      for (int j = firstFrom; j < validEnd; j++) {
        if (buffer[j] != CLOSE) {
          continue;
        }
        Optional<JsonObject> object = decodeObject(buffer, i, j);
        if (object.isPresent()) {
          segments.add(new Segment(i, j, object.get()));
          break;
        }
      }
    }
    return segments;
  }

  private static Optional<JsonObject> decodeObject(byte[] buffer, int start, int end) {
    return JsonCodec.tryParse(buffer, start, end - start + 1).flatMap(JsonValue::asObject);
  }

  /**
   * Returns the exclusive index up to which {@code buffer[from..]} decodes as UTF-8.
   *
   * <p>Any range ending at or beyond the first malformed byte is itself malformed, so candidates past it
   * can be skipped. A multi-byte sequence cut off by {@code to} only matters for ranges ending inside it,
   * and those cannot end on an ASCII brace.</p>
   */
  private static int validUtf8End(
      CharsetDecoder decoder, CharBuffer scratch, byte[] buffer, int from, int to) {
    decoder.reset();
    scratch.clear();
    ByteBuffer in = ByteBuffer.wrap(buffer, from, to - from);
    CoderResult result = decoder.decode(in, scratch, true);
    if (result.isError()) {
      return in.position();
    }
    return to;
  }
}
