package com.ospicorp.costforecast.forecast.adapter;

/** The backend is not installed, not configured or not reachable. */
public class BackendUnavailableException extends BackendException {

  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
