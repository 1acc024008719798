package com.ospicorp.costforecast.forecast.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.costforecast.forecast.model.DartsModel;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ModelOrder;
import com.ospicorp.costforecast.forecast.model.SeasonalOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.function.Supplier;

/**
 * Optional per-request parameter values. Anything left {@code null} keeps the configured default.
 */
@Schema(description = "Algorithm parameter overrides; omitted fields keep the configured defaults")
public record ParameterOverrides(
    @JsonProperty("sma_window") @Schema(example = "7") Integer smaWindow,
    @JsonProperty("es_alpha") @Schema(example = "0.5") Double esAlpha,
    @JsonProperty("hw_alpha") Double hwAlpha,
    @JsonProperty("hw_beta") Double hwBeta,
    @JsonProperty("hw_gamma") Double hwGamma,
    @JsonProperty("hw_seasonal_periods") @Schema(example = "12") Integer hwSeasonalPeriods,
    @JsonProperty("theta") @Schema(example = "2.0") Double theta,
    @JsonProperty("arima") Boolean arima,
    @JsonProperty("arima_order") @Schema(example = "1,1,1") String arimaOrder,
    @JsonProperty("sarima") Boolean sarima,
    @JsonProperty("sarima_order") @Schema(example = "1,1,1") String sarimaOrder,
    @JsonProperty("sarima_seasonal_order") @Schema(example = "1,1,1,12") String sarimaSeasonalOrder,
    @JsonProperty("prophet") Boolean prophet,
    @JsonProperty("prophet_daily_seasonality") Boolean prophetDailySeasonality,
    @JsonProperty("prophet_yearly_seasonality") Boolean prophetYearlySeasonality,
    @JsonProperty("prophet_weekly_seasonality") Boolean prophetWeeklySeasonality,
    @JsonProperty("prophet_changepoint_prior_scale") Double prophetChangepointPriorScale,
    @JsonProperty("prophet_seasonality_prior_scale") Double prophetSeasonalityPriorScale,
    @JsonProperty("neural_prophet") Boolean neuralProphet,
    @JsonProperty("darts_algorithm") @Schema(example = "exponential_smoothing",
        description = "Enables Darts with the given model") String dartsAlgorithm
) {

  static final int INVALID_SMA_WINDOW = 2001;
  static final int INVALID_ES_ALPHA = 2002;
  static final int INVALID_HOLT_WINTERS = 2003;
  static final int INVALID_THETA = 2004;
  static final int INVALID_ARIMA_ORDER = 2005;
  static final int INVALID_SARIMA_ORDER = 2006;
  static final int INVALID_PROPHET = 2007;
  static final int INVALID_DARTS_ALGORITHM = 2008;

  /**
   * Applies the non-null overrides on top of {@code base}.
   *
   * @throws InvalidParameterException naming the first rejected value
   */
  public ForecastParameters applyTo(ForecastParameters base) {
    ForecastParameters result = base;
    if (smaWindow != null) {
      int window = smaWindow;
      result = checked(INVALID_SMA_WINDOW, () -> base.withSmaWindow(window));
    }
    if (esAlpha != null) {
      ForecastParameters current = result;
      result = checked(INVALID_ES_ALPHA, () -> current.withEsAlpha(esAlpha));
    }
    if (hwAlpha != null || hwBeta != null || hwGamma != null || hwSeasonalPeriods != null) {
      ForecastParameters current = result;
      ForecastParameters.HoltWinters hw = current.holtWinters();
      result = checked(INVALID_HOLT_WINTERS, () -> current.withHoltWinters(
          new ForecastParameters.HoltWinters(
              hwAlpha != null ? hwAlpha : hw.alpha(),
              hwBeta != null ? hwBeta : hw.beta(),
              hwGamma != null ? hwGamma : hw.gamma(),
              hwSeasonalPeriods != null ? hwSeasonalPeriods : hw.seasonalPeriods())));
    }
    if (theta != null) {
      ForecastParameters current = result;
      result = checked(INVALID_THETA, () -> current.withTheta(theta));
    }
    if (arima != null || arimaOrder != null) {
      ForecastParameters current = result;
      ForecastParameters.Arima value = current.arima();
      result = checked(INVALID_ARIMA_ORDER, () -> current.withArima(new ForecastParameters.Arima(
          arima != null ? arima : value.enabled(),
          arimaOrder != null ? ModelOrder.parse(arimaOrder) : value.order())));
    }
    if (sarima != null || sarimaOrder != null || sarimaSeasonalOrder != null) {
      ForecastParameters current = result;
      ForecastParameters.Sarima value = current.sarima();
      result = checked(INVALID_SARIMA_ORDER, () -> current.withSarima(
          new ForecastParameters.Sarima(
              sarima != null ? sarima : value.enabled(),
              sarimaOrder != null ? ModelOrder.parse(sarimaOrder) : value.order(),
              sarimaSeasonalOrder != null
                  ? SeasonalOrder.parse(sarimaSeasonalOrder) : value.seasonalOrder())));
    }
    if (prophet != null || prophetDailySeasonality != null || prophetYearlySeasonality != null
        || prophetWeeklySeasonality != null || prophetChangepointPriorScale != null
        || prophetSeasonalityPriorScale != null) {
      ForecastParameters current = result;
      ForecastParameters.Prophet value = current.prophet();
      result = checked(INVALID_PROPHET, () -> current.withProphet(
          new ForecastParameters.Prophet(
              prophet != null ? prophet : value.enabled(),
              prophetDailySeasonality != null
                  ? prophetDailySeasonality : value.dailySeasonality(),
              prophetYearlySeasonality != null
                  ? prophetYearlySeasonality : value.yearlySeasonality(),
              prophetWeeklySeasonality != null
                  ? prophetWeeklySeasonality : value.weeklySeasonality(),
              prophetChangepointPriorScale != null
                  ? prophetChangepointPriorScale : value.changepointPriorScale(),
              prophetSeasonalityPriorScale != null
                  ? prophetSeasonalityPriorScale : value.seasonalityPriorScale())));
    }
    if (neuralProphet != null) {
      result = result.withNeuralProphet(new ForecastParameters.NeuralProphet(neuralProphet));
    }
    if (dartsAlgorithm != null && !dartsAlgorithm.isBlank()) {
      ForecastParameters current = result;
      result = checked(INVALID_DARTS_ALGORITHM, () -> current.withDarts(
          new ForecastParameters.Darts(true, DartsModel.fromCode(dartsAlgorithm))));
    }
    return result;
  }

  private static ForecastParameters checked(int errorCode, Supplier<ForecastParameters> update) {
    try {
      return update.get();
    } catch (IllegalArgumentException ex) {
      throw InvalidParameterException.of(ex.getMessage(), errorCode);
    }
  }
}
