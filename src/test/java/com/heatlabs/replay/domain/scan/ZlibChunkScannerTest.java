package com.heatlabs.replay.domain.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.zip.Deflater;
import org.junit.jupiter.api.Test;

class ZlibChunkScannerTest {
  private final ZlibChunkScanner scanner = new ZlibChunkScanner();

  @Test
  void inflatesEmbeddedTextStream() {
    String text = "{\"m_endGameType\": \"Win\"} ".repeat(4);
    byte[] compressed = deflate(text.getBytes(StandardCharsets.UTF_8));
    byte[] buffer = concat(filler(20), compressed, filler(300));

    ZlibChunk chunk = chunkAt(scanner.scan(buffer), 20).orElseThrow();

    assertEquals(20 + Math.max(ZlibChunkScanner.MIN_SPAN, compressed.length), chunk.endOffset());
    assertEquals(text.length(), chunk.inflatedSize());
    assertEquals(Optional.of(text), chunk.text());
  }

  @Test
  void binaryPayloadHasNoText() {
    byte[] payload = new byte[64];
    Arrays.fill(payload, (byte) 0xFF);
    byte[] buffer = concat(filler(8), deflate(payload), filler(200));

    ZlibChunk chunk = chunkAt(scanner.scan(buffer), 8).orElseThrow();

    assertFalse(chunk.isText());
    assertEquals(64, chunk.inflatedSize());
  }

  @Test
  void headerTooCloseToEndIsSkipped() {
    byte[] buffer = concat(filler(10), deflate("short".getBytes(StandardCharsets.UTF_8)));

    assertTrue(scanner.scan(buffer).isEmpty());
  }

  @Test
  void headerWithoutStreamIsSkipped() {
    byte[] buffer = concat(filler(4), new byte[] {0x78, (byte) 0x9C}, filler(400));

    assertTrue(chunkAt(scanner.scan(buffer), 4).isEmpty());
  }

  private static Optional<ZlibChunk> chunkAt(List<ZlibChunk> chunks, int start) {
    return chunks.stream().filter(chunk -> chunk.startOffset() == start).findFirst();
  }

  private static byte[] deflate(byte[] input) {
    Deflater deflater = new Deflater();
    try {
      deflater.setInput(input);
      deflater.finish();
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] block = new byte[1024];
      while (!deflater.finished()) {
        int n = deflater.deflate(block);
        out.write(block, 0, n);
      }
      return out.toByteArray();
    } finally {
      deflater.end();
    }
  }

  private static byte[] filler(int length) {
    byte[] bytes = new byte[length];
    Arrays.fill(bytes, (byte) 'A');
    return bytes;
  }

  private static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.writeBytes(part);
    }
    return out.toByteArray();
  }
}
