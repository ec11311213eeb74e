package com.ospicorp.demandtrends.trend.model.enums;

public enum CauseType {
  EXTERNAL_EVENT, PROCESS_CHANGE, SEASONAL_EFFECT, SYSTEM_CHANGE, BUSINESS_DECISION
}
