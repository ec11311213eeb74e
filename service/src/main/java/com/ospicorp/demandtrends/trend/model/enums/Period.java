package com.ospicorp.demandtrends.trend.model.enums;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

public enum Period {
  HOURLY(Duration.ofHours(1)),
  DAILY(Duration.ofDays(1)),
  WEEKLY(Duration.ofDays(7)),
  MONTHLY(Duration.ofDays(30)),
  QUARTERLY(Duration.ofDays(91));

  private final Duration length;

  Period(Duration length) {
    this.length = length;
  }

  public Duration length() {
    return length;
  }

  public double lengthMinutes() {
    return length.toMinutes();
  }

  /**
   * Calendar cycle that residuals of a series sampled at this period are bucketed by when the
   * seasonal component is extracted.
   */
  public Periodicity dominantPeriodicity() {
    return switch (this) {
      case HOURLY -> Periodicity.HOURLY;
      case DAILY -> Periodicity.WEEKLY;
      case WEEKLY, MONTHLY, QUARTERLY -> Periodicity.MONTHLY;
    };
  }

  public Set<Periodicity> seasonalPeriodicities() {
    return switch (this) {
      case HOURLY -> EnumSet.of(Periodicity.HOURLY, Periodicity.WEEKLY, Periodicity.HOLIDAY);
      case DAILY -> EnumSet.of(Periodicity.HOURLY, Periodicity.WEEKLY, Periodicity.MONTHLY,
          Periodicity.HOLIDAY);
      case WEEKLY -> EnumSet.of(Periodicity.WEEKLY, Periodicity.MONTHLY);
      case MONTHLY -> EnumSet.of(Periodicity.MONTHLY);
      case QUARTERLY -> EnumSet.noneOf(Periodicity.class);
    };
  }
}
