package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.ComparisonType;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.util.List;
import java.util.Objects;

public record CompareRequest(
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_ids") List<String> entityIds,
    @JsonProperty("metric_names") List<String> metricNames,
    @JsonProperty("comparison_type") ComparisonType comparisonType,
    Period period
) {

  public CompareRequest {
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("entity_type must be provided");
    }
    if (entityIds == null || entityIds.isEmpty()) {
      throw new IllegalArgumentException("entity_ids must not be empty");
    }
    if (metricNames == null || metricNames.isEmpty()) {
      throw new IllegalArgumentException("metric_names must not be empty");
    }
    entityIds = List.copyOf(entityIds);
    metricNames = List.copyOf(metricNames);
    comparisonType = Objects.requireNonNullElse(comparisonType, ComparisonType.SEGMENT_COMPARISON);
    period = Objects.requireNonNullElse(period, Period.DAILY);
  }
}
