package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record DetectedPattern(
    String name,
    String description,
    double frequency,
    double significance,
    @JsonProperty("next_occurrence") Instant nextOccurrence
) {}
