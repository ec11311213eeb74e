package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.InsightType;
import com.ospicorp.demandtrends.trend.model.enums.Significance;

public record TrendInsight(
    InsightType type,
    String title,
    String description,
    Significance significance,
    double confidence,
    @JsonProperty("actionability_score") double actionabilityScore
) {}
