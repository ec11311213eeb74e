package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendComponent(
    ComponentKind kind,
    double strength,
    @JsonProperty("r_squared") double rSquared,
    @JsonProperty("contribution_pct") double contributionPct,
    String equation,
    String description
) {

  public TrendComponent {
    Objects.requireNonNull(kind, "kind");
    requireUnit(strength, "strength");
    requireUnit(rSquared, "r_squared");
  }

  public static TrendComponent of(ComponentKind kind, double share, String equation,
      String description) {
    return new TrendComponent(kind, share, share, share * 100d, equation, description);
  }

  private static void requireUnit(double value, String name) {
    if (!(value >= 0d && value <= 1d)) {
      throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
    }
  }
}
