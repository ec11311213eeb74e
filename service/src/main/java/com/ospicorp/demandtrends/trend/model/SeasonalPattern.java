package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeasonalPattern(
    Periodicity periodicity,
    double strength,
    int phase,
    double amplitude,
    @JsonProperty("period_length") int periodLength,
    double reliability,
    @JsonProperty("next_peak") Instant nextPeak,
    @JsonProperty("next_trough") Instant nextTrough,
    @JsonProperty("detected_patterns") List<DetectedPattern> detectedPatterns
) {

  public SeasonalPattern {
    Objects.requireNonNull(periodicity, "periodicity");
    detectedPatterns = List.copyOf(detectedPatterns);
  }
}
