package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisDepth;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.util.Objects;

public record AnalysisRequest(
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("metric_name") String metricName,
    Period period,
    AnalysisDepth depth
) {

  public AnalysisRequest {
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("entity_type must be provided");
    }
    if (metricName == null || metricName.isBlank()) {
      throw new IllegalArgumentException("metric_name must be provided");
    }
    period = Objects.requireNonNullElse(period, Period.DAILY);
    depth = Objects.requireNonNullElse(depth, AnalysisDepth.ADVANCED);
  }

  public static AnalysisRequest of(String entityType, String entityId, String metricName,
      Period period) {
    return new AnalysisRequest(entityType, entityId, metricName, period, AnalysisDepth.ADVANCED);
  }

  public EntityRef entity() {
    return new EntityRef(entityType, entityId);
  }

  public AnalysisKey key() {
    return new AnalysisKey(entityType, entityId, metricName, period);
  }
}
