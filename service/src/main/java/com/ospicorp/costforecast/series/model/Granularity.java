package com.ospicorp.costforecast.series.model;

public enum Granularity {
  DAILY,
  MONTHLY
}
