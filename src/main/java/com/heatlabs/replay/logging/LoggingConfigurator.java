package com.heatlabs.replay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the CLI {@code --verbose} flag to the logging backend.
 * <p><strong>Why:</strong> Lets operators see per-file extraction detail without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Call once from the CLI thread before work starts.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings only get a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String APPLICATION_LOGGER = "com.heatlabs.replay";

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root and application loggers to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
      Logger application = context.getLogger(APPLICATION_LOGGER);
      if (application.getLevel() != null) {
        application.setLevel(Level.DEBUG);
      }
      log.debug("Verbose logging enabled");
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
