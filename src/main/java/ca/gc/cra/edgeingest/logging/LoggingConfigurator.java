package ca.gc.cra.edgeingest.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import java.util.Set;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} or {@code logLevel=} while
 * troubleshooting, without editing {@code logback.xml} on the edge host.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger level to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level.
   *
   * @param level one of {@code TRACE, DEBUG, INFO, WARN, ERROR, OFF}, case-insensitive; blank keeps the
   *     configured level
   * @throws IllegalArgumentException if the level name is unknown
   */
  public static void applyRootLevel(String level) {
    if (level == null || level.isBlank()) {
      return;
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    if (!LEVELS.contains(normalized)) {
      throw new IllegalArgumentException("logLevel must be one of " + LEVELS + " (was " + level + ")");
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level target = Level.toLevel(normalized);
      if (!target.equals(root.getLevel())) {
        root.setLevel(target);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        normalized, factory.getClass().getName());
  }
}
