package com.ospicorp.demandtrends.trend.model.enums;

/** Recent span checked against a forecast fitted on the history before it. */
public enum AnomalyWindow {
  LAST_24H(Period.HOURLY, 24),
  LAST_WEEK(Period.HOURLY, 168),
  LAST_MONTH(Period.DAILY, 30);

  private final Period period;
  private final int periods;

  AnomalyWindow(Period period, int periods) {
    this.period = period;
    this.periods = periods;
  }

  public Period period() {
    return period;
  }

  public int periods() {
    return periods;
  }
}
