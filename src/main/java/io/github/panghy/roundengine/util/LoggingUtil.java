package io.github.panghy.roundengine.util;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers on top of JUL (java.util.logging).
 *
 * <p>Records are emitted with {@code logp} so the source class and method are
 * those of the caller, not of this helper. The {@link Supplier} overloads
 * build their message only when the level is enabled; engines resolve millions
 * of rounds during calibration and must not pay for formatting they discard.</p>
 */
public final class LoggingUtil {

  private LoggingUtil() {
    // Utility class should not be instantiated
  }

  /**
   * Gets the caller information from the stack trace.
   * Skips LoggingUtil frames to find the actual caller.
   */
  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // Skip: 0=getStackTrace, 1=getCaller, 2=log, 3=public entry point
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, Supplier<String> message, Throwable throwable) {
    if (!logger.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = getCaller();
    if (throwable == null) {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message.get());
    } else {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message.get(), throwable);
    }
  }

  /**
   * Logs a debug message, building it only if FINE is enabled.
   *
   * @param logger  The logger to use
   * @param message Supplier of the message to log
   */
  public static void debug(Logger logger, Supplier<String> message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs an info message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, () -> message, null);
  }

  /**
   * Logs a warning message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    log(logger, Level.WARNING, () -> message, null);
  }

  /**
   * Logs an exception at the error level with full stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void error(Logger logger, String message, Throwable throwable) {
    log(logger, Level.SEVERE, () -> message, throwable);
  }
}
