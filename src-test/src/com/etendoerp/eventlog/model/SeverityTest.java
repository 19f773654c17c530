package com.etendoerp.eventlog.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeverityTest {

  @ParameterizedTest
  @CsvSource({
      "0, INFO",
      "1, FATAL",
      "2, ERROR",
      "3, WARN",
      "4, INFO",
      "5, DEBUG",
      "6, UNSPECIFIED",
      "-1, UNSPECIFIED"
  })
  void mapsEventLevels(long level, Severity expected) {
    assertEquals(expected, Severity.fromEventLevel(level));
  }
}
