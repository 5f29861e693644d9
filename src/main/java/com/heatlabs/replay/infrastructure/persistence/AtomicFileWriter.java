package com.heatlabs.replay.infrastructure.persistence;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Replaces a file's content in one step: write a sibling temp file, force it to disk,
 * then rename it over the target.
 * <p><strong>Why:</strong> Readers and interrupted runs only ever observe the previous or the new
 * content, never a partial write.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent writers to the same target race on the final
 * rename and the last one wins.</p>
 *
 * @since 0.1.0
 */
public final class AtomicFileWriter {
  private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

  /** Writes the new content to the temp file stream. */
  @FunctionalInterface
  public interface Body {
    void writeTo(OutputStream out) throws IOException;
  }

  private AtomicFileWriter() {}

  /**
   * Atomically replaces {@code target} with the bytes produced by {@code body}.
   *
   * @param target file to replace; parent directories are created when missing
   * @param body producer of the new content; must not close the stream
   * @throws IOException if writing, forcing or renaming fails; the temp file is removed and the
   *     target left untouched
   */
  public static void write(Path target, Body body) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(body, "body");
    Path absolute = target.toAbsolutePath();
    Path dir = absolute.getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }
    Path temp = Files.createTempFile(dir, absolute.getFileName().toString() + ".", ".tmp");
    boolean moved = false;
    try {
      try (FileChannel channel = FileChannel.open(
              temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
          OutputStream out = Channels.newOutputStream(channel)) {
        body.writeTo(out);
        out.flush();
        channel.force(true);
      }
      move(temp, absolute);
      moved = true;
    } finally {
      if (!moved) {
        deleteQuietly(temp);
      }
    }
  }

  private static void move(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.warn("Failed to remove temporary file {}", temp, ex);
    }
  }
}
