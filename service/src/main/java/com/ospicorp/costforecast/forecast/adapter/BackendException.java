package com.ospicorp.costforecast.forecast.adapter;

/** A backend was reached but could not fit or predict. */
public class BackendException extends RuntimeException {

  public BackendException(String message) {
    super(message);
  }

  public BackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
