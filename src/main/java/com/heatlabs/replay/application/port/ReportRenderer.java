package com.heatlabs.replay.application.port;

import com.heatlabs.replay.domain.stats.StatisticsReport;
import java.io.IOException;
import java.io.Writer;

/**
 * <strong>What:</strong> Port rendering a {@link StatisticsReport} to a character stream.
 * <p><strong>Role:</strong> Implemented by {@code TextReportRenderer} and {@code JsonReportRenderer}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless.</p>
 *
 * @since 0.1.0
 */
public interface ReportRenderer {
  /**
   * Writes {@code report} to {@code out} without closing it.
   *
   * @param report report to render
   * @param out destination writer
   * @throws IOException if writing fails
   */
  void render(StatisticsReport report, Writer out) throws IOException;
}
