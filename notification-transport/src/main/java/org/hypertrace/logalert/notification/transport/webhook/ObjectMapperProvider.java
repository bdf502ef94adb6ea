package org.hypertrace.logalert.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/** Shared mapper for outgoing notification payloads; null properties are left out. */
public final class ObjectMapperProvider {
  private static final ObjectMapper OBJECT_MAPPER =
      JsonMapper.builder().serializationInclusion(Include.NON_NULL).build();

  private ObjectMapperProvider() {}

  public static ObjectMapper get() {
    return OBJECT_MAPPER;
  }
}
