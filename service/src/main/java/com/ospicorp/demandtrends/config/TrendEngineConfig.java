package com.ospicorp.demandtrends.config;

import com.ospicorp.demandtrends.trend.service.CalendarExternalFactorEvaluator;
import com.ospicorp.demandtrends.trend.service.ExternalFactorEvaluator;
import com.ospicorp.demandtrends.trend.service.HolidayCalendar;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TrendEngineConfig {

  private static final Logger log = LoggerFactory.getLogger(TrendEngineConfig.class);

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  ExternalFactorEvaluator externalFactorEvaluator(TrendAnalysisProperties properties,
      HolidayCalendar calendar) {
    if (properties.getForecast().isCalendarFactorsEnabled()) {
      log.info("Calendar external factors enabled for {} holidays", calendar.holidays().size());
      return new CalendarExternalFactorEvaluator(calendar);
    }
    return ExternalFactorEvaluator.NONE;
  }

  @Bean
  ThreadPoolTaskExecutor bulkAnalysisExecutor(TrendAnalysisProperties properties) {
    int threads = Math.max(1, properties.getBulk().getBatchSize());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads * 10);
    executor.setThreadNamePrefix("trend-bulk-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
