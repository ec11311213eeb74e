package com.ospicorp.demandtrends.trend.model;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Objects;

/** Calendar entry; {@code month} is 1-12. */
public record Holiday(String name, int month, int day) {

  public Holiday {
    Objects.requireNonNull(name, "name");
    MonthDay.of(month, day);
  }

  public MonthDay monthDay() {
    return MonthDay.of(month, day);
  }

  // Feb 29 falls back to Feb 28 in non-leap years.
  public LocalDate inYear(int year) {
    return monthDay().atYear(year);
  }
}
