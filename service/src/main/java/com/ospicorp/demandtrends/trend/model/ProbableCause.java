package com.ospicorp.demandtrends.trend.model;

import com.ospicorp.demandtrends.trend.model.enums.CauseType;

public record ProbableCause(CauseType type, String description, double likelihood) {}
