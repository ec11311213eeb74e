package com.ospicorp.demandtrends.trend.model;

import com.ospicorp.demandtrends.trend.model.enums.Period;

/** Cache identity of an analysis. Depth is not part of it. */
public record AnalysisKey(String entityType, String entityId, String metricName, Period period) {}
