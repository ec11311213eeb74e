package com.ospicorp.demandtrends.support;

import com.ospicorp.demandtrends.trend.model.Sample;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

public final class SampleSeries {
  // a Monday
  public static final Instant MONDAY = Instant.parse("2024-01-01T00:00:00Z");

  private SampleSeries() {
  }

  public static List<Sample> daily(Instant start, int count, IntToDoubleFunction value) {
    return every(Duration.ofDays(1), start, count, value);
  }

  public static List<Sample> hourly(Instant start, int count, IntToDoubleFunction value) {
    return every(Duration.ofHours(1), start, count, value);
  }

  public static List<Sample> every(Duration step, Instant start, int count,
      IntToDoubleFunction value) {
    List<Sample> samples = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      samples.add(new Sample(start.plus(step.multipliedBy(i)), value.applyAsDouble(i)));
    }
    return samples;
  }
}
