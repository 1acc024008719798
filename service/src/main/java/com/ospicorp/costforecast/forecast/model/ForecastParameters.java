package com.ospicorp.costforecast.forecast.model;

import java.util.Objects;

/**
 * Resolved parameters for every algorithm of one run. Values are validated on construction.
 */
public record ForecastParameters(
    int smaWindow,
    double esAlpha,
    HoltWinters holtWinters,
    double theta,
    Arima arima,
    Sarima sarima,
    Prophet prophet,
    NeuralProphet neuralProphet,
    Darts darts
) {

  public static final int DEFAULT_SMA_WINDOW = 7;
  public static final double DEFAULT_ES_ALPHA = 0.5;
  public static final double DEFAULT_THETA = 2d;

  public ForecastParameters {
    if (smaWindow < 1) {
      throw new IllegalArgumentException("sma window must be a positive integer");
    }
    requireUnitInterval("es alpha", esAlpha);
    if (!Double.isFinite(theta)) {
      throw new IllegalArgumentException("theta must be a finite number");
    }
    Objects.requireNonNull(holtWinters, "holtWinters");
    Objects.requireNonNull(arima, "arima");
    Objects.requireNonNull(sarima, "sarima");
    Objects.requireNonNull(prophet, "prophet");
    Objects.requireNonNull(neuralProphet, "neuralProphet");
    Objects.requireNonNull(darts, "darts");
  }

  public static ForecastParameters defaults() {
    return new ForecastParameters(DEFAULT_SMA_WINDOW, DEFAULT_ES_ALPHA, HoltWinters.defaults(),
        DEFAULT_THETA, Arima.defaults(), Sarima.defaults(), Prophet.defaults(),
        NeuralProphet.defaults(), Darts.defaults());
  }

  public ForecastParameters withSmaWindow(int window) {
    return new ForecastParameters(window, esAlpha, holtWinters, theta, arima, sarima, prophet,
        neuralProphet, darts);
  }

  public ForecastParameters withEsAlpha(double alpha) {
    return new ForecastParameters(smaWindow, alpha, holtWinters, theta, arima, sarima, prophet,
        neuralProphet, darts);
  }

  public ForecastParameters withHoltWinters(HoltWinters value) {
    return new ForecastParameters(smaWindow, esAlpha, value, theta, arima, sarima, prophet,
        neuralProphet, darts);
  }

  public ForecastParameters withTheta(double value) {
    return new ForecastParameters(smaWindow, esAlpha, holtWinters, value, arima, sarima, prophet,
        neuralProphet, darts);
  }

  public ForecastParameters withArima(Arima value) {
    return new ForecastParameters(smaWindow, esAlpha, holtWinters, theta, value, sarima, prophet,
        neuralProphet, darts);
  }

  public ForecastParameters withSarima(Sarima value) {
    return new ForecastParameters(smaWindow, esAlpha, holtWinters, theta, arima, value, prophet,
        neuralProphet, darts);
  }

  public ForecastParameters withProphet(Prophet value) {
    return new ForecastParameters(smaWindow, esAlpha, holtWinters, theta, arima, sarima, value,
        neuralProphet, darts);
  }

  public ForecastParameters withNeuralProphet(NeuralProphet value) {
    return new ForecastParameters(smaWindow, esAlpha, holtWinters, theta, arima, sarima, prophet,
        value, darts);
  }

  public ForecastParameters withDarts(Darts value) {
    return new ForecastParameters(smaWindow, esAlpha, holtWinters, theta, arima, sarima, prophet,
        neuralProphet, value);
  }

  /** Whether the external backend behind {@code algorithm} is switched on. */
  public boolean isEnabled(Algorithm algorithm) {
    return switch (algorithm) {
      case ARIMA -> arima.enabled();
      case SARIMA -> sarima.enabled();
      case PROPHET -> prophet.enabled();
      case NEURAL_PROPHET -> neuralProphet.enabled();
      case DARTS -> darts.enabled();
      default -> true;
    };
  }

  static void requireUnitInterval(String name, double value) {
    if (!(value > 0d && value <= 1d)) {
      throw new IllegalArgumentException(name + " must be in (0, 1], got " + value);
    }
  }

  static void requireClosedUnitInterval(String name, double value) {
    if (!(value >= 0d && value <= 1d)) {
      throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
    }
  }

  public record HoltWinters(double alpha, double beta, double gamma, int seasonalPeriods) {
    public static final double DEFAULT_ALPHA = 0.3;
    public static final double DEFAULT_BETA = 0.1;
    public static final double DEFAULT_GAMMA = 0.1;
    public static final int DEFAULT_SEASONAL_PERIODS = 12;

    public HoltWinters {
      requireUnitInterval("hw alpha", alpha);
      requireClosedUnitInterval("hw beta", beta);
      requireClosedUnitInterval("hw gamma", gamma);
      if (seasonalPeriods < 1) {
        throw new IllegalArgumentException("hw seasonal periods must be a positive integer");
      }
    }

    public static HoltWinters defaults() {
      return new HoltWinters(DEFAULT_ALPHA, DEFAULT_BETA, DEFAULT_GAMMA, DEFAULT_SEASONAL_PERIODS);
    }
  }

  public record Arima(boolean enabled, ModelOrder order) {
    public Arima {
      Objects.requireNonNull(order, "order");
    }

    public static Arima defaults() {
      return new Arima(false, new ModelOrder(1, 1, 1));
    }
  }

  public record Sarima(boolean enabled, ModelOrder order, SeasonalOrder seasonalOrder) {
    public Sarima {
      Objects.requireNonNull(order, "order");
      Objects.requireNonNull(seasonalOrder, "seasonalOrder");
    }

    public static Sarima defaults() {
      return new Sarima(false, new ModelOrder(1, 1, 1), new SeasonalOrder(1, 1, 1, 12));
    }
  }

  public record Prophet(
      boolean enabled,
      boolean dailySeasonality,
      boolean yearlySeasonality,
      boolean weeklySeasonality,
      double changepointPriorScale,
      double seasonalityPriorScale
  ) {
    public Prophet {
      if (!(changepointPriorScale > 0d) || !(seasonalityPriorScale > 0d)) {
        throw new IllegalArgumentException("prophet prior scales must be positive");
      }
    }

    public static Prophet defaults() {
      return new Prophet(true, true, true, false, 0.05, 10.0);
    }
  }

  public record NeuralProphet(boolean enabled) {
    public static NeuralProphet defaults() {
      return new NeuralProphet(false);
    }
  }

  public record Darts(boolean enabled, DartsModel model) {
    public Darts {
      Objects.requireNonNull(model, "model");
    }

    public static Darts defaults() {
      return new Darts(false, DartsModel.EXPONENTIAL_SMOOTHING);
    }
  }
}
