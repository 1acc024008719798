package com.ospicorp.costforecast.forecast.adapter;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

/** One dated value exchanged with a backend, in the {@code ds}/{@code y} shape backends expect. */
public record BackendPoint(
    @JsonProperty("ds") LocalDate date,
    @JsonProperty("y") Double value
) {
}
