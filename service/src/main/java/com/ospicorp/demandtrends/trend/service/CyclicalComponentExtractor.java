package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.enums.Period;

/**
 * Extracts a slow cyclical signal from the residuals left after the linear and seasonal fits.
 * Implementations return an array of the same length as {@code residuals}.
 */
public interface CyclicalComponentExtractor {

  double[] extract(double[] residuals, Period period);
}
