package com.etendoerp.eventlog.delivery;

import java.util.Map;

import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

import com.etendoerp.eventlog.model.LogRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Writes {@link LogRecord}s as JSON. Timestamps are ISO-8601 strings.
 */
public class LogRecordSerializer implements Serializer<LogRecord> {
  private final ObjectMapper objectMapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @Override
  public void configure(Map<String, ?> configs, boolean isKey) {
    /* No configuration needed */
  }

  @Override
  public byte[] serialize(String topic, LogRecord data) {
    if (data == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsBytes(data);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Error serializing log record for topic " + topic, e);
    }
  }

  @Override
  public void close() {
    /* Nothing to release */
  }
}
