package com.etendoerp.eventlog.model;

/**
 * Normalized log severity.
 */
public enum Severity {
  UNSPECIFIED,
  TRACE,
  DEBUG,
  INFO,
  WARN,
  ERROR,
  FATAL;

  /**
   * Maps a Windows event level to a severity. Level 0 ("LogAlways") is informational.
   */
  public static Severity fromEventLevel(long level) {
    if (level < 0 || level > 5) {
      return UNSPECIFIED;
    }
    switch ((int) level) {
      case 0:
      case 4:
        return INFO;
      case 1:
        return FATAL;
      case 2:
        return ERROR;
      case 3:
        return WARN;
      case 5:
        return DEBUG;
      default:
        return UNSPECIFIED;
    }
  }
}
