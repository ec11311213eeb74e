package com.ospicorp.demandtrends.trend.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Sample(Instant timestamp, double value) {

  public Sample {
    Objects.requireNonNull(timestamp, "timestamp");
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("sample value must be finite at " + timestamp);
    }
  }

  public long epochMillis() {
    return timestamp.toEpochMilli();
  }

  public static List<Sample> requireStrictlyAscending(List<Sample> samples) {
    Objects.requireNonNull(samples, "samples");
    for (int i = 1; i < samples.size(); i++) {
      Instant previous = samples.get(i - 1).timestamp();
      Instant current = samples.get(i).timestamp();
      if (!current.isAfter(previous)) {
        throw new IllegalArgumentException(
            "samples must be strictly ascending by timestamp; found " + current + " after " + previous);
      }
    }
    return samples;
  }
}
