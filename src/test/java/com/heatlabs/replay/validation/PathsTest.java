package com.heatlabs.replay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireReadableDirectoryAcceptsDirectory() {
    assertEquals(tempDir.toAbsolutePath().normalize(), Paths.requireReadableDirectory("in", tempDir));
  }

  @Test
  void requireReadableDirectoryRejectsFile() throws Exception {
    Path file = Files.createFile(tempDir.resolve("a.replay"));

    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDirectory("in", file));
  }

  @Test
  void requireReadableFileRejectsMissingFile() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Paths.requireReadableFile("file", tempDir.resolve("missing.replay")));
  }

  @Test
  void validateOutputFileCreatesParentDirectories() {
    Path output = tempDir.resolve("nested/dir/corpus.json");

    Path normalized = Paths.validateOutputFile("corpus", output);

    assertTrue(Files.isDirectory(normalized.getParent()));
    assertTrue(normalized.isAbsolute());
  }

  @Test
  void validateOutputFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile("corpus", tempDir));
  }

  @Test
  void rejectsControlCharacters() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Paths.requireReadableDirectory("in", Path.of("bad\u0007dir")));
  }
}
