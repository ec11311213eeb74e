package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.enums.AnalysisStage;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.util.Locale;

public class InsufficientDataException extends TrendAnalysisException {
  private final int observed;
  private final int required;

  public InsufficientDataException(Period period, int observed, int required) {
    super(AnalysisStage.DECOMPOSING, "Insufficient data for " + period.name().toLowerCase(Locale.ROOT)
        + " analysis: " + observed + " samples, at least " + required + " required");
    this.observed = observed;
    this.required = required;
  }

  public int observed() {
    return observed;
  }

  public int required() {
    return required;
  }
}
