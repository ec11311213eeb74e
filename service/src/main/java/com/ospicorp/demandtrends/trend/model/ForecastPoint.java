package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ForecastPoint(
    Instant timestamp,
    @JsonProperty("periods_ahead") int periodsAhead,
    @JsonProperty("point_estimate") double pointEstimate,
    @JsonProperty("lower_bound") double lowerBound,
    @JsonProperty("upper_bound") double upperBound,
    double confidence,
    @JsonProperty("trend_value") double trendValue,
    @JsonProperty("seasonal_adjustment") double seasonalAdjustment,
    @JsonProperty("external_adjustment") double externalAdjustment,
    @JsonProperty("confidence_intervals") List<ConfidenceInterval> confidenceIntervals,
    @JsonProperty("contributing_factors") Map<String, Double> contributingFactors
) {

  public ForecastPoint {
    confidenceIntervals = List.copyOf(confidenceIntervals);
    contributingFactors = Map.copyOf(contributingFactors);
    if (!(lowerBound <= pointEstimate && pointEstimate <= upperBound)) {
      throw new IllegalArgumentException("forecast bounds [" + lowerBound + ", " + upperBound
          + "] do not contain estimate " + pointEstimate);
    }
  }
}
