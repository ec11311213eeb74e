package com.ospicorp.demandtrends.trend.model.enums;

public enum ChangeDirection {
  INCREASE, DECREASE
}
