package com.heatlabs.replay.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileWriterTest {
  @TempDir Path dir;

  @Test
  void createsParentsAndReplacesContent() throws Exception {
    Path target = dir.resolve("nested/out/corpus.json");

    AtomicFileWriter.write(target, out -> out.write("first".getBytes(StandardCharsets.UTF_8)));
    AtomicFileWriter.write(target, out -> out.write("second".getBytes(StandardCharsets.UTF_8)));

    assertEquals("second", Files.readString(target));
    assertEquals(List.of(target), listing(target.getParent()));
  }

  @Test
  void failedBodyLeavesPreviousContentAndNoTempFile() throws Exception {
    Path target = dir.resolve("corpus.json");
    Files.writeString(target, "previous");

    IOException thrown = assertThrows(IOException.class, () -> AtomicFileWriter.write(target, out -> {
      out.write("partial".getBytes(StandardCharsets.UTF_8));
      throw new IOException("disk full");
    }));

    assertEquals("disk full", thrown.getMessage());
    assertEquals("previous", Files.readString(target));
    assertEquals(List.of(target), listing(dir));
  }

  private static List<Path> listing(Path directory) throws IOException {
    try (Stream<Path> files = Files.list(directory)) {
      return files.toList();
    }
  }
}
