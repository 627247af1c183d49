package com.ospicorp.priceapi.weather;

public class WeatherFetchException extends RuntimeException {
  public WeatherFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
