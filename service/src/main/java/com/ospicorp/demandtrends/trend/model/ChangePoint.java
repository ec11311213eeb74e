package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import com.ospicorp.demandtrends.trend.model.enums.Significance;
import java.time.Instant;
import java.util.List;

public record ChangePoint(
    Instant timestamp,
    double magnitude,
    ChangeDirection direction,
    double confidence,
    Significance significance,
    @JsonProperty("requires_action") boolean requiresAction,
    @JsonProperty("probable_causes") List<ProbableCause> probableCauses
) {

  public ChangePoint {
    probableCauses = List.copyOf(probableCauses);
  }
}
