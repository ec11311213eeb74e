package com.ospicorp.demandtrends.trend.model.enums;

public enum OutlierKind {
  SPIKE, DROP
}
