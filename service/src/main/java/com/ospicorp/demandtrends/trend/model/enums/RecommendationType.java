package com.ospicorp.demandtrends.trend.model.enums;

public enum RecommendationType {
  INVESTIGATE, MONITOR, TAKE_ACTION
}
