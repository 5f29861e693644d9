package com.heatlabs.replay.infrastructure.persistence;

import com.heatlabs.replay.application.port.CorpusSource;
import com.heatlabs.replay.domain.replay.Corpus;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Corpus document on the local filesystem.
 *
 * <p>Reads stream through {@link CorpusJsonCodec}; writes go through {@link AtomicFileWriter} so the file is
 * always either the previous or the new complete document. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class JsonCorpusFile implements CorpusSource {
  private final Path path;
  private final CorpusJsonCodec codec;

  public JsonCorpusFile(Path path) {
    this(path, new CorpusJsonCodec());
  }

  JsonCorpusFile(Path path, CorpusJsonCodec codec) {
    this.path = Objects.requireNonNull(path, "path");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public Path path() {
    return path;
  }

  public boolean exists() {
    return Files.isRegularFile(path);
  }

  /**
   * Reads the document.
   *
   * @return decoded corpus
   * @throws java.nio.file.NoSuchFileException if the file does not exist
   * @throws CorpusFormatException if the content is not a corpus document
   * @throws IOException if reading fails
   */
  @Override
  public Corpus load() throws IOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
      return codec.read(in);
    }
  }

  /**
   * Atomically replaces the document with {@code corpus}.
   *
   * @param corpus corpus to persist
   * @throws IOException if the write fails; the previous document stays in place
   */
  public void write(Corpus corpus) throws IOException {
    Objects.requireNonNull(corpus, "corpus");
    AtomicFileWriter.write(path, out -> codec.write(corpus, out));
  }
}
