package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.ExternalFactor;
import com.ospicorp.demandtrends.trend.model.enums.FactorType;
import java.time.Instant;

/** Applies calendar factors on days near a configured holiday; other factor types are ignored. */
public class CalendarExternalFactorEvaluator implements ExternalFactorEvaluator {

  private final HolidayCalendar calendar;

  public CalendarExternalFactorEvaluator(HolidayCalendar calendar) {
    this.calendar = calendar;
  }

  @Override
  public double impact(ExternalFactor factor, Instant timestamp) {
    if (factor.type() != FactorType.CALENDAR) {
      return 0d;
    }
    return calendar.holidayNear(timestamp).isPresent()
        ? factor.impactStrength() * factor.correlation()
        : 0d;
  }
}
