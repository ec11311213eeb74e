package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

public record EntityRef(
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_id") String entityId
) {

  public EntityRef {
    Objects.requireNonNull(entityType, "entityType");
    if (entityType.isBlank()) {
      throw new IllegalArgumentException("entity_type must be provided");
    }
  }

  public static EntityRef of(String entityType) {
    return new EntityRef(entityType, null);
  }

  @Override
  public String toString() {
    return entityId == null ? entityType : entityType + "/" + entityId;
  }
}
