package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.enums.AnalysisStage;

/** History retrieval failed; callers may retry. */
public class ExternalFetchException extends TrendAnalysisException {

  public ExternalFetchException(String message, Throwable cause) {
    super(AnalysisStage.FETCHING, message, cause);
  }
}
