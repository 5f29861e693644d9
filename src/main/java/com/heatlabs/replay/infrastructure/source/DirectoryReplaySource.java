package com.heatlabs.replay.infrastructure.source;

import com.heatlabs.replay.application.port.ReplaySource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplaySource} listing regular files in a directory whose name ends with a given extension.
 *
 * <p>Extension matching is case-insensitive. Results are sorted by path so repeated runs see the same
 * order. Stateless apart from its configuration; safe to reuse.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryReplaySource implements ReplaySource {
  private static final Logger log = LoggerFactory.getLogger(DirectoryReplaySource.class);

  private final Path directory;
  private final String extension;
  private final boolean recursive;

  /**
   * Creates a source.
   *
   * @param directory directory to list
   * @param extension required filename suffix including the dot, e.g. {@code .replay}
   * @param recursive whether sub-directories are walked
   */
  public DirectoryReplaySource(Path directory, String extension, boolean recursive) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.extension = Objects.requireNonNull(extension, "extension").toLowerCase(Locale.ROOT);
    this.recursive = recursive;
  }

  @Override
  public List<Path> discover() throws IOException {
    List<Path> files;
    try (Stream<Path> entries = recursive ? Files.walk(directory) : Files.list(directory)) {
      files = entries
          .filter(Files::isRegularFile)
          .filter(this::matchesExtension)
          .sorted()
          .collect(Collectors.toList());
    }
    log.info(
        "Discovered {} {} files in {}{}",
        files.size(),
        extension,
        directory,
        recursive ? " (recursive)" : "");
    return files;
  }

  private boolean matchesExtension(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(extension);
  }
}
