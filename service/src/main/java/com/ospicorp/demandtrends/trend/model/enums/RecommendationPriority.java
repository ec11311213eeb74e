package com.ospicorp.demandtrends.trend.model.enums;

public enum RecommendationPriority {
  LOW, MEDIUM, HIGH, URGENT
}
