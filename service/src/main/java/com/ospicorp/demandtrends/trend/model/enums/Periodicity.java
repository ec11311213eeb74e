package com.ospicorp.demandtrends.trend.model.enums;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public enum Periodicity {
  HOURLY(24),
  WEEKLY(7),
  MONTHLY(12),
  HOLIDAY(365);

  private final int periodLength;

  Periodicity(int periodLength) {
    this.periodLength = periodLength;
  }

  public int periodLength() {
    return periodLength;
  }

  public boolean isCyclic() {
    return this != HOLIDAY;
  }

  /**
   * Phase bucket of a timestamp: hour 0-23, ISO weekday 0 (Monday) to 6 (Sunday), month 0-11.
   */
  public int bucketOf(Instant timestamp, ZoneId zone) {
    ZonedDateTime local = timestamp.atZone(zone);
    return switch (this) {
      case HOURLY -> local.getHour();
      case WEEKLY -> local.getDayOfWeek().getValue() - 1;
      case MONTHLY -> local.getMonthValue() - 1;
      case HOLIDAY -> throw new UnsupportedOperationException("holiday seasonality has no phase buckets");
    };
  }
}
