package com.ospicorp.costforecast.forecast.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AlgorithmInfo(
    @JsonProperty("name") String name,
    @JsonProperty("external") boolean external,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("runs_by_default") boolean runsByDefault
) {
}
