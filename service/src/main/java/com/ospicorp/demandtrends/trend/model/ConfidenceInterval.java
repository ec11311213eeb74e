package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConfidenceInterval(
    @JsonProperty("confidence_level") double confidenceLevel,
    @JsonProperty("lower_bound") double lowerBound,
    @JsonProperty("upper_bound") double upperBound
) {}
