package io.github.panghy.roundengine.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for LoggingUtil.
 */
public class LoggingUtilTest {

  private final List<LogRecord> records = new ArrayList<>();
  private Logger logger;
  private Handler handler;

  @BeforeEach
  public void setUp() {
    logger = Logger.getLogger(LoggingUtilTest.class.getName());
    logger.setUseParentHandlers(false);
    handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        records.add(record);
      }

      @Override
      public void flush() {
      }

      @Override
      public void close() {
      }
    };
    handler.setLevel(Level.ALL);
    logger.addHandler(handler);
  }

  @AfterEach
  public void tearDown() {
    logger.removeHandler(handler);
    logger.setUseParentHandlers(true);
    logger.setLevel(null);
  }

  @Test
  public void testDebugSupplierSkippedWhenDisabled() {
    logger.setLevel(Level.INFO);
    AtomicInteger calls = new AtomicInteger();
    LoggingUtil.debug(logger, () -> "round " + calls.incrementAndGet());
    assertEquals(0, calls.get());
    assertThat(records).isEmpty();
  }

  @Test
  public void testDebugWhenEnabled() {
    logger.setLevel(Level.FINE);
    LoggingUtil.debug(logger, () -> "resolved");
    assertThat(records).hasSize(1);
    assertEquals(Level.FINE, records.get(0).getLevel());
    assertEquals("resolved", records.get(0).getMessage());
  }

  @Test
  public void testCallerIsRecorded() {
    logger.setLevel(Level.INFO);
    LoggingUtil.info(logger, "hello");
    LogRecord record = records.get(0);
    assertEquals(LoggingUtilTest.class.getName(), record.getSourceClassName());
    assertEquals("testCallerIsRecorded", record.getSourceMethodName());
  }

  @Test
  public void testLevels() {
    logger.setLevel(Level.ALL);
    IllegalStateException failure = new IllegalStateException("boom");
    LoggingUtil.info(logger, "info");
    LoggingUtil.warn(logger, "warn");
    LoggingUtil.error(logger, "error", failure);
    assertThat(records).extracting(LogRecord::getLevel)
        .containsExactly(Level.INFO, Level.WARNING, Level.SEVERE);
    assertSame(failure, records.get(2).getThrown());
  }
}
