package com.ospicorp.priceapi.web;

public class InvalidParameterException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://docs.price-api.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode, String moreInfo) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public static InvalidParameterException of(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
