package com.ospicorp.demandtrends.trend.model.enums;

// Lifecycle of one analysis call; any stage may move to FAILED.
public enum AnalysisStage {
  IDLE,
  FETCHING,
  DECOMPOSING,
  DETECTING_CHANGES,
  DETECTING_SEASONALITY,
  SCANNING_OUTLIERS,
  FORECASTING,
  ASSEMBLING,
  CACHED,
  FAILED
}
