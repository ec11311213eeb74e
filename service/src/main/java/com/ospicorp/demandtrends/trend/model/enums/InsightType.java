package com.ospicorp.demandtrends.trend.model.enums;

public enum InsightType {
  PATTERN_DISCOVERY, ANOMALY_DETECTION, PERFORMANCE_CHANGE
}
