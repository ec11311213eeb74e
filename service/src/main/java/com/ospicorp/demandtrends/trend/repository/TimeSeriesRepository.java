package com.ospicorp.demandtrends.trend.repository;

import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.TimeWindow;
import java.util.List;

public interface TimeSeriesRepository {

  /**
   * Samples of {@code metricName} within {@code window}, strictly ascending by timestamp.
   *
   * @param entityId {@code null} for the aggregate over all entities of the type
   * @throws com.ospicorp.demandtrends.trend.service.ExternalFetchException when the store cannot
   *     be reached or answers with an error
   */
  List<Sample> fetchHistory(String entityType, String entityId, String metricName,
      TimeWindow window);
}
