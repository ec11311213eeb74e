package com.ospicorp.demandtrends.trend.model.enums;

public enum DifferenceType {
  SIGNIFICANT_INCREASE, SIGNIFICANT_DECREASE, STRUCTURAL_CHANGE, VOLATILITY_CHANGE
}
