package com.ospicorp.costforecast.series.service;

public class SeriesSchemaException extends RuntimeException {

  public SeriesSchemaException(String message) {
    super(message);
  }

  public SeriesSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
