package org.hypertrace.logalert.datamodel;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Function;

/**
 * Reads log batches shipped as JSON. A batch is either an array of records or a single record.
 * Every record needs a {@code message}; {@code timestamp} and {@code level} may be absent.
 */
public class LogEntryReader {
  static final String TIMESTAMP = "timestamp";
  static final String LEVEL = "level";
  static final String MESSAGE = "message";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Object> OBJECT_TYPE = new TypeReference<>() {};
  private static final List<Function<String, Instant>> TIMESTAMP_PARSERS =
      List.of(
          Instant::parse,
          value -> OffsetDateTime.parse(value).toInstant(),
          value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));

  public List<LogEntry> read(String json) throws IOException {
    return read(OBJECT_MAPPER.readTree(json));
  }

  public List<LogEntry> read(InputStream inputStream) throws IOException {
    return read(OBJECT_MAPPER.readTree(inputStream));
  }

  public List<LogEntry> read(JsonNode batch) throws IOException {
    if (batch == null || batch.isMissingNode() || batch.isNull()) {
      return List.of();
    }
    if (batch.isObject()) {
      return List.of(toLogEntry(batch));
    }
    if (!batch.isArray()) {
      throw new IOException("Log batch should be an array of log records");
    }
    List<LogEntry> logEntries = new ArrayList<>(batch.size());
    for (JsonNode record : batch) {
      logEntries.add(toLogEntry(record));
    }
    return logEntries;
  }

  LogEntry toLogEntry(JsonNode record) throws IOException {
    if (!record.isObject()) {
      throw new IOException(String.format("Log record should be an object:%s", record));
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    Iterator<Entry<String, JsonNode>> iterator = record.fields();
    while (iterator.hasNext()) {
      Entry<String, JsonNode> field = iterator.next();
      if (!TIMESTAMP.equals(field.getKey())
          && !LEVEL.equals(field.getKey())
          && !MESSAGE.equals(field.getKey())) {
        fields.put(field.getKey(), OBJECT_MAPPER.convertValue(field.getValue(), OBJECT_TYPE));
      }
    }
    JsonNode level = record.get(LEVEL);
    JsonNode message = record.get(MESSAGE);
    return LogEntry.builder()
        .timestamp(parseTimestamp(record.get(TIMESTAMP)))
        .level(level == null || level.isNull() ? null : LogLevel.fromString(level.asText()))
        .message(message == null || message.isNull() ? "" : message.asText())
        .fields(fields)
        .build();
  }

  static Instant parseTimestamp(JsonNode timestamp) throws IOException {
    if (timestamp == null || timestamp.isNull()) {
      return null;
    }
    if (timestamp.isIntegralNumber()) {
      return Instant.ofEpochMilli(timestamp.asLong());
    }
    if (timestamp.isNumber()) {
      // fractional numbers are epoch seconds
      BigDecimal seconds = timestamp.decimalValue();
      long wholeSeconds = seconds.setScale(0, RoundingMode.FLOOR).longValue();
      long nanos = seconds.subtract(BigDecimal.valueOf(wholeSeconds)).movePointRight(9).longValue();
      return Instant.ofEpochSecond(wholeSeconds, nanos);
    }
    return parseTimestamp(timestamp.asText());
  }

  /** Accepts ISO-8601 instants, offset date-times and local date-times, the latter read as UTC. */
  public static Instant parseTimestamp(String timestamp) throws IOException {
    DateTimeParseException failure = null;
    for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
      try {
        return parser.apply(timestamp);
      } catch (DateTimeParseException e) {
        failure = e;
      }
    }
    throw new IOException(String.format("Unparseable log timestamp:%s", timestamp), failure);
  }
}
