package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record CapacityRecommendation(
    Instant timestamp,
    @JsonProperty("recommended_agents") int recommendedAgents,
    @JsonProperty("predicted_workload") double predictedWorkload,
    @JsonProperty("offered_load") double offeredLoad,
    @JsonProperty("target_service_level") double targetServiceLevel,
    @JsonProperty("predicted_service_level") double predictedServiceLevel,
    @JsonProperty("cost_delta") double costDelta,
    double confidence,
    boolean capped,
    String reason
) {

  public CapacityRecommendation {
    if (recommendedAgents < 0) {
      throw new IllegalArgumentException("recommended_agents must not be negative");
    }
  }
}
