package com.ospicorp.costforecast.forecast.model;

public enum DiagnosticKind {
  BACKEND_DISABLED,
  BACKEND_UNAVAILABLE,
  BACKEND_FAILED,
  HOLT_WINTERS_FALLBACK,
  CONSTANT_SERIES_FALLBACK,
  NON_FINITE_VALUES,
  FORECASTER_FAILED
}
