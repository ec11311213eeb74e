package com.ospicorp.demandtrends.trend.model.enums;

public enum TrendDirection {
  INCREASING,
  DECREASING,
  STABLE,
  VOLATILE,
  SEASONAL,
  TRENDING_UP_WITH_SEASONALITY,
  TRENDING_DOWN_WITH_SEASONALITY
}
