package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.Holiday;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Configured holidays, matched against dates in the configured zone. */
@Component
public class HolidayCalendar {

  private final List<Holiday> holidays;
  private final int windowDays;
  private final ZoneId zone;

  public HolidayCalendar(TrendAnalysisProperties properties) {
    this.holidays = List.copyOf(properties.getSeasonality().getHolidays());
    this.windowDays = Math.max(0, properties.getSeasonality().getHolidayWindowDays());
    this.zone = properties.getZone();
  }

  public List<Holiday> holidays() {
    return holidays;
  }

  public boolean isEmpty() {
    return holidays.isEmpty();
  }

  public int windowDays() {
    return windowDays;
  }

  public ZoneId zone() {
    return zone;
  }

  public Optional<Holiday> holidayNear(Instant timestamp) {
    return holidayNear(timestamp.atZone(zone).toLocalDate());
  }

  public Optional<Holiday> holidayNear(LocalDate date) {
    for (Holiday holiday : holidays) {
      if (isNear(holiday, date)) {
        return Optional.of(holiday);
      }
    }
    return Optional.empty();
  }

  public boolean isNear(Holiday holiday, LocalDate date) {
    for (int year = date.getYear() - 1; year <= date.getYear() + 1; year++) {
      long distance = Math.abs(ChronoUnit.DAYS.between(holiday.inYear(year), date));
      if (distance <= windowDays) {
        return true;
      }
    }
    return false;
  }

  /** Start of the next day on which {@code holiday} falls, strictly after {@code now}. */
  public ZonedDateTime nextOccurrence(Holiday holiday, ZonedDateTime now) {
    ZonedDateTime local = now.withZoneSameInstant(zone);
    ZonedDateTime candidate = holiday.inYear(local.getYear()).atStartOfDay(zone);
    if (!candidate.isAfter(local)) {
      candidate = holiday.inYear(local.getYear() + 1).atStartOfDay(zone);
    }
    return candidate;
  }
}
