package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.time.Instant;

public record TimeWindow(
    Instant start,
    Instant end,
    Period period,
    @JsonProperty("expected_period_count") int expectedPeriodCount,
    @JsonProperty("observed_count") int observedCount,
    @JsonProperty("completeness_ratio") double completenessRatio
) {

  public static TimeWindow ending(Instant end, Period period, int expectedPeriodCount) {
    Instant start = end.minus(period.length().multipliedBy(expectedPeriodCount));
    return new TimeWindow(start, end, period, expectedPeriodCount, 0, 0d);
  }

  public TimeWindow withObserved(int observed) {
    double ratio = expectedPeriodCount <= 0
        ? 0d
        : Math.min(1d, (double) observed / expectedPeriodCount);
    return new TimeWindow(start, end, period, expectedPeriodCount, observed, ratio);
  }
}
