package com.codeheadsystems.veil.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON marshaler. Objects come back as maps, lists, strings, numbers and booleans.
 */
@Singleton
public class JacksonMarshaler implements Marshaler {

  private static final Logger log = LoggerFactory.getLogger(JacksonMarshaler.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Jackson marshaler.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public JacksonMarshaler(final ObjectMapper objectMapper) {
    log.info("JacksonMarshaler({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  @Override
  public String marshal(final Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize " + value.getClass().getName(), e);
    }
  }

  @Override
  public Object unmarshal(final String serialized) {
    try {
      return objectMapper.readValue(serialized, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed serialized payload", e);
    }
  }
}
