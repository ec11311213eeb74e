package com.ospicorp.demandtrends.trend.model.enums;

public enum Significance {
  LOW, MEDIUM, HIGH, CRITICAL
}
