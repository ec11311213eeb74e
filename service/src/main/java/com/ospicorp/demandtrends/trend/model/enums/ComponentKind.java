package com.ospicorp.demandtrends.trend.model.enums;

public enum ComponentKind {
  LINEAR, SEASONAL, CYCLICAL, NOISE
}
