package com.ospicorp.costforecast.forecast.adapter;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ProphetForecaster extends ExternalForecaster {

  public ProphetForecaster(ForecastBackend backend) {
    super(backend);
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.PROPHET;
  }

  @Override
  protected Map<String, Object> options(ForecastParameters parameters) {
    return seasonalityOptions(parameters.prophet());
  }

  static Map<String, Object> seasonalityOptions(ForecastParameters.Prophet prophet) {
    return Map.of(
        "daily_seasonality", prophet.dailySeasonality(),
        "yearly_seasonality", prophet.yearlySeasonality(),
        "weekly_seasonality", prophet.weeklySeasonality(),
        "changepoint_prior_scale", prophet.changepointPriorScale(),
        "seasonality_prior_scale", prophet.seasonalityPriorScale());
  }
}
