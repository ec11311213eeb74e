package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.ProbableCause;
import com.ospicorp.demandtrends.trend.model.enums.CauseType;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class HolidayProbableCauseLookup implements ProbableCauseLookup {
  private static final double HOLIDAY_LIKELIHOOD = 0.7;

  private final HolidayCalendar calendar;

  public HolidayProbableCauseLookup(HolidayCalendar calendar) {
    this.calendar = calendar;
  }

  @Override
  public List<ProbableCause> causesFor(Instant timestamp, ChangeDirection direction) {
    return calendar.holidayNear(timestamp)
        .map(holiday -> List.of(new ProbableCause(CauseType.SEASONAL_EFFECT,
            String.format(Locale.ROOT, "%s within %d day(s) of %s",
                direction == ChangeDirection.INCREASE ? "Increase" : "Decrease",
                calendar.windowDays(), holiday.name()),
            HOLIDAY_LIKELIHOOD)))
        .orElse(List.of());
  }
}
