package com.ospicorp.demandtrends.trend.model.enums;

public enum ComparisonType {
  PERIOD_OVER_PERIOD, COHORT_ANALYSIS, SEGMENT_COMPARISON, BENCHMARK_COMPARISON
}
