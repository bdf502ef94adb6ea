package org.hypertrace.logalert.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogEntryReaderTest {

  private final LogEntryReader logEntryReader = new LogEntryReader();

  @Test
  void testReadBatch() throws IOException {
    String batch =
        "["
            + "{\"timestamp\": \"2024-03-01T10:00:00Z\", \"level\": \"error\","
            + " \"message\": \"ERROR a\", \"service\": \"checkout\", \"attempt\": 2},"
            + "{\"timestamp\": \"2024-03-01T10:00:01\", \"level\": \"Info\", \"message\": \"ok\"},"
            + "{\"timestamp\": 1709287202000, \"level\": \"WARN\", \"message\": \"slow\"}"
            + "]";

    List<LogEntry> logEntries = logEntryReader.read(batch);

    assertEquals(3, logEntries.size());
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"), logEntries.get(0).getTimestamp());
    assertEquals(LogLevel.ERROR, logEntries.get(0).getLevel());
    assertEquals("ERROR a", logEntries.get(0).getMessage());
    assertEquals(Map.of("service", "checkout", "attempt", 2), logEntries.get(0).getFields());

    assertEquals(Instant.parse("2024-03-01T10:00:01Z"), logEntries.get(1).getTimestamp());
    assertEquals(LogLevel.INFO, logEntries.get(1).getLevel());

    assertEquals(Instant.parse("2024-03-01T10:00:02Z"), logEntries.get(2).getTimestamp());
    assertEquals(LogLevel.WARNING, logEntries.get(2).getLevel());
  }

  @Test
  void testSingleRecordWithoutTimestamp() throws IOException {
    List<LogEntry> logEntries = logEntryReader.read("{\"message\": \"heartbeat\"}");

    assertEquals(1, logEntries.size());
    assertNull(logEntries.get(0).getTimestamp());
    assertNull(logEntries.get(0).getLevel());
    Instant now = Instant.parse("2024-03-01T10:00:00Z");
    assertEquals(now, logEntries.get(0).getTimestampOrDefault(now));
  }

  @Test
  void testOffsetTimestamp() throws IOException {
    assertEquals(
        Instant.parse("2024-03-01T08:00:00Z"),
        LogEntryReader.parseTimestamp("2024-03-01T10:00:00+02:00"));
  }

  @Test
  void testFractionalEpochSeconds() throws IOException {
    List<LogEntry> logEntries =
        logEntryReader.read(
            "[{\"timestamp\": 1709287200.5, \"message\": \"a\"},"
                + " {\"timestamp\": 1709287200000, \"message\": \"b\"}]");

    assertEquals(Instant.parse("2024-03-01T10:00:00.500Z"), logEntries.get(0).getTimestamp());
    assertEquals(Instant.parse("2024-03-01T10:00:00Z"), logEntries.get(1).getTimestamp());
  }

  @Test
  void testInvalidInput() {
    assertThrows(IOException.class, () -> logEntryReader.read("\"just a string\""));
    assertThrows(
        IOException.class,
        () -> logEntryReader.read("[{\"timestamp\": \"yesterday\", \"message\": \"x\"}]"));
    assertThrows(
        IllegalArgumentException.class,
        () -> logEntryReader.read("[{\"level\": \"LOUD\", \"message\": \"x\"}]"));
  }
}
