package com.ospicorp.demandtrends.trend.controller;

/**
 * A request parameter the trend endpoints cannot accept. Carries the offending parameter name and
 * a numeric error code whose documentation page is derived from it.
 */
public class InvalidParameterException extends RuntimeException {
  static final String ERROR_DOCS_BASE = "https://docs.demand-trends.dev/errors/";

  private final String parameter;
  private final int errorCode;

  public InvalidParameterException(String parameter, int errorCode, String message) {
    super(message);
    this.parameter = parameter;
    this.errorCode = errorCode;
  }

  public String parameter() {
    return parameter;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
