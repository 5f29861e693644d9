package com.heatlabs.replay.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port that discovers replay inputs for a batch run.
 * <p><strong>Role:</strong> Implemented by {@code DirectoryReplaySource}.</p>
 *
 * @since 0.1.0
 */
public interface ReplaySource {
  /**
   * Lists the files to process.
   *
   * @return input paths in a stable order
   * @throws IOException if the input location cannot be listed
   */
  List<Path> discover() throws IOException;
}
