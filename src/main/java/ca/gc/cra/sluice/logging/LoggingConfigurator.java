package ca.gc.cra.sluice.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts sluice logging at CLI startup.
 * <p><strong>Why:</strong> {@code --verbose} should expose per-hop saturation and drain traces without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their configuration.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String BASE_PACKAGE = "ca.gc.cra.sluice";

  private LoggingConfigurator() {
    // Utility
  }

  /** Lowers the root and {@code ca.gc.cra.sluice} loggers to DEBUG. */
  public static void enableVerboseLogging() {
    setLevel(Level.DEBUG);
  }

  /**
   * Reports whether the sluice loggers currently emit DEBUG.
   *
   * @return {@code true} when verbose logging is active
   */
  public static boolean isVerbose() {
    return LoggerFactory.getLogger(BASE_PACKAGE).isDebugEnabled();
  }

  private static void setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      context.getLogger(BASE_PACKAGE).setLevel(level);
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
