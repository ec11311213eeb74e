package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.enums.AnalysisStage;

public class TrendAnalysisException extends RuntimeException {
  private final AnalysisStage stage;

  public TrendAnalysisException(AnalysisStage stage, String message) {
    super(message);
    this.stage = stage;
  }

  public TrendAnalysisException(AnalysisStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public AnalysisStage stage() {
    return stage;
  }
}
