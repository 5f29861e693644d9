package com.heatlabs.replay.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryReplaySourceTest {
  @TempDir Path dir;

  @BeforeEach
  void populate() throws IOException {
    Files.write(dir.resolve("b.replay"), new byte[] {1});
    Files.write(dir.resolve("a.REPLAY"), new byte[] {1});
    Files.write(dir.resolve("notes.txt"), new byte[] {1});
    Files.createDirectories(dir.resolve("folder.replay"));
    Files.createDirectories(dir.resolve("nested"));
    Files.write(dir.resolve("nested/c.replay"), new byte[] {1});
  }

  @Test
  void listsMatchingFilesSortedAndCaseInsensitive() throws Exception {
    List<Path> files = new DirectoryReplaySource(dir, ".replay", false).discover();

    assertEquals(List.of(dir.resolve("a.REPLAY"), dir.resolve("b.replay")), files);
  }

  @Test
  void recursiveWalkIncludesSubdirectories() throws Exception {
    List<Path> files = new DirectoryReplaySource(dir, ".Replay", true).discover();

    assertEquals(
        List.of(dir.resolve("a.REPLAY"), dir.resolve("b.replay"), dir.resolve("nested/c.replay")),
        files);
  }

  @Test
  void otherExtensionsAreSelectable() throws Exception {
    assertEquals(List.of(dir.resolve("notes.txt")), new DirectoryReplaySource(dir, ".txt", true).discover());
  }

  @Test
  void missingDirectoryFails() {
    DirectoryReplaySource source = new DirectoryReplaySource(dir.resolve("absent"), ".replay", false);

    assertThrows(NoSuchFileException.class, source::discover);
  }
}
