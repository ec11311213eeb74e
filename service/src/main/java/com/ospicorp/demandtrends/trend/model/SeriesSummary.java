package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SeriesSummary(
    int count,
    double mean,
    @JsonProperty("std_dev") double stdDev,
    double min,
    double max,
    @JsonProperty("last_value") double lastValue,
    @JsonProperty("earlier_half") HalfStats earlierHalf,
    @JsonProperty("later_half") HalfStats laterHalf
) {

  public record HalfStats(int count, double mean, double variance) {}
}
