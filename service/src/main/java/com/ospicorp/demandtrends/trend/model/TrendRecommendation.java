package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.RecommendationPriority;
import com.ospicorp.demandtrends.trend.model.enums.RecommendationType;

public record TrendRecommendation(
    RecommendationType type,
    RecommendationPriority priority,
    String title,
    String description,
    String rationale,
    String timeline,
    @JsonProperty("responsible_team") String responsibleTeam
) {}
