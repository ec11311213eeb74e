package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.ProbableCause;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import java.time.Instant;
import java.util.List;

/** Candidate explanations for a level shift; an empty list is a valid answer. */
public interface ProbableCauseLookup {

  List<ProbableCause> causesFor(Instant timestamp, ChangeDirection direction);
}
