package com.heatlabs.replay.domain.scan;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * <strong>What:</strong> Finds zlib streams (header {@code 0x78 0x9C}) embedded in replay bytes.
 * <p><strong>Policy:</strong> For every header offset {@code i} the reported end is the first
 * {@code j} in {@code [i + MIN_SPAN, min(i + WINDOW, length))} such that {@code buffer[i..j)} holds a
 * complete stream. Bytes after the end of the stream are ignored, so {@code j} is the larger of
 * {@code i + MIN_SPAN} and the end of the compressed data. Header offsets inside an earlier chunk are
 * still tried.</p>
 * <p><strong>Limits:</strong> Inflated output is capped at {@link #MAX_INFLATED_BYTES}; a stream that
 * would inflate past the cap is not reported.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call owns its {@link Inflater}.</p>
 *
 * @since 0.1.0
 */
public final class ZlibChunkScanner {
  /** Shortest window tried after a header. */
  public static final int MIN_SPAN = 100;
  /** Exclusive bound on the window length after a header. */
  public static final int WINDOW = 50_000;
  /** Upper bound on the inflated size of a single chunk. */
  public static final int MAX_INFLATED_BYTES = 16 * 1024 * 1024;

  private static final byte CMF = 0x78;
  private static final byte FLG_DEFAULT = (byte) 0x9C;

  /**
   * Scans {@code buffer} for complete zlib streams.
   *
   * @param buffer raw replay bytes
   * @return chunks ordered by start offset
   */
  public List<ZlibChunk> scan(byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer");
    List<ZlibChunk> chunks = new ArrayList<>();
    Inflater inflater = new Inflater();
    try {
      for (int i = 0; i + 1 < buffer.length; i++) {
        if (buffer[i] != CMF || buffer[i + 1] != FLG_DEFAULT) {
          continue;
        }
        int bound = Math.min(i + WINDOW, buffer.length);
        if (i + MIN_SPAN >= bound) {
          continue;
        }
        inflater.reset();
        tryInflate(inflater, buffer, i, bound - 1).ifPresent(chunks::add);
      }
    } finally {
      inflater.end();
    }
    return chunks;
  }

  private static Optional<ZlibChunk> tryInflate(Inflater inflater, byte[] buffer, int start, int limit) {
    int available = limit - start;
    inflater.setInput(buffer, start, available);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] block = new byte[8192];
    try {
      while (!inflater.finished()) {
        int produced = inflater.inflate(block);
        if (produced == 0 && !inflater.finished()) {
          // Truncated within the window or needs a preset dictionary.
          return Optional.empty();
        }
        if (out.size() + produced > MAX_INFLATED_BYTES) {
          return Optional.empty();
        }
        out.write(block, 0, produced);
      }
    } catch (DataFormatException ex) {
      // Not a stream at this offset.
      return Optional.empty();
    }
    int consumed = available - inflater.getRemaining();
    int end = start + Math.max(MIN_SPAN, consumed);
    byte[] payload = out.toByteArray();
    return Optional.of(new ZlibChunk(start, end, payload.length, decodeStrict(payload)));
  }

  private static Optional<String> decodeStrict(byte[] payload) {
    try {
      return Optional.of(StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(payload))
          .toString());
    } catch (CharacterCodingException ex) {
      return Optional.empty();
    }
  }
}
