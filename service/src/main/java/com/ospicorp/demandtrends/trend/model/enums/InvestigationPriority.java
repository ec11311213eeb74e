package com.ospicorp.demandtrends.trend.model.enums;

public enum InvestigationPriority {
  LOW, MEDIUM, HIGH, CRITICAL
}
