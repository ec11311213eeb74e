package com.ospicorp.demandtrends.trend.model.enums;

public enum AnalysisDepth {
  BASIC, ADVANCED, COMPREHENSIVE
}
