package com.ospicorp.demandtrends.trend.model.enums;

public enum FactorType {
  CALENDAR, ECONOMIC, WEATHER, EVENT, BUSINESS
}
