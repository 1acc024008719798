package com.ospicorp.costforecast.series.model;

import java.time.LocalDate;

public record DataPoint(LocalDate date, Double value) {}
