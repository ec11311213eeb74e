package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.OutlierKind;
import java.time.Instant;
import java.util.List;

/** An observed value outside the forecast band predicted for its timestamp. */
public record AnomalyPoint(
    Instant timestamp,
    @JsonProperty("actual_value") double actualValue,
    @JsonProperty("predicted_value") double predictedValue,
    @JsonProperty("deviation_score") double deviationScore,
    @JsonProperty("anomaly_type") OutlierKind anomalyType,
    double confidence,
    @JsonProperty("possible_causes") List<ProbableCause> possibleCauses
) {

  public AnomalyPoint {
    possibleCauses = List.copyOf(possibleCauses);
  }
}
