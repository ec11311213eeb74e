package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.InvestigationPriority;
import com.ospicorp.demandtrends.trend.model.enums.OutlierKind;
import java.time.Instant;

public record OutlierPoint(
    Instant timestamp,
    double observed,
    double expected,
    @JsonProperty("deviation_score") double deviationScore,
    OutlierKind kind,
    InvestigationPriority priority
) {}
