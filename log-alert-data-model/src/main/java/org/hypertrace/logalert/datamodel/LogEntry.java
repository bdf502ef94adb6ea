package org.hypertrace.logalert.datamodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** A single structured log record of an ingested batch. Instances are immutable. */
@Getter
@ToString
public class LogEntry {
  // null when the shipper did not provide one
  private final Instant timestamp;
  private final LogLevel level;
  private final String message;
  private final Map<String, Object> fields;

  @Builder
  private LogEntry(
      Instant timestamp, LogLevel level, String message, Map<String, Object> fields) {
    this.timestamp = timestamp;
    this.level = level;
    this.message = message == null ? "" : message;
    this.fields =
        fields == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Optional<Instant> getOptionalTimestamp() {
    return Optional.ofNullable(timestamp);
  }

  public Instant getTimestampOrDefault(Instant defaultTimestamp) {
    return timestamp == null ? defaultTimestamp : timestamp;
  }
}
