package com.ospicorp.costforecast.forecast.model;

/** Non-fatal condition raised while producing one algorithm's forecast. */
public record Diagnostic(Algorithm algorithm, DiagnosticKind kind, String message) {}
