package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.ExternalFactor;
import java.time.Instant;

/**
 * Relative impact of one external factor on demand at a forecast timestamp, for example
 * {@code -0.3} for a 30% drop. Impacts of all configured factors are summed.
 */
@FunctionalInterface
public interface ExternalFactorEvaluator {

  ExternalFactorEvaluator NONE = (factor, timestamp) -> 0d;

  double impact(ExternalFactor factor, Instant timestamp);
}
