package io.pitwall.tyre.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts model logging verbosity at runtime.
 * <p><strong>Why:</strong> Lets a session enable per-stint fit diagnostics through {@code debugLogging} without
 * editing the Logback configuration.</p>
 * <p><strong>Role:</strong> Adapter-side utility bridging {@code ModelConfig} to the logging backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded model construction.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String MODEL_LOGGER = "io.pitwall.tyre";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@code io.pitwall.tyre} logger to DEBUG.
   *
   * @return {@code true} when the level was applied; {@code false} when the backend is not Logback
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(MODEL_LOGGER);
      if (!Level.DEBUG.equals(logger.getLevel())) {
        logger.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
