package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.FactorType;
import java.util.Objects;

public record ExternalFactor(
    String name,
    FactorType type,
    @JsonProperty("impact_strength") double impactStrength,
    double correlation
) {

  public ExternalFactor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
