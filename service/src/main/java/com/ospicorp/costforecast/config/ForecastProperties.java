package com.ospicorp.costforecast.config;

import com.ospicorp.costforecast.forecast.model.DartsModel;
import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import com.ospicorp.costforecast.forecast.model.ModelOrder;
import com.ospicorp.costforecast.forecast.model.SeasonalOrder;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Algorithm defaults bound from {@code forecast.*}. Request level overrides are applied on top of
 * {@link #toParameters()}.
 */
@ConfigurationProperties("forecast")
public class ForecastProperties {

  private int smaWindow = ForecastParameters.DEFAULT_SMA_WINDOW;
  private double esAlpha = ForecastParameters.DEFAULT_ES_ALPHA;
  private double theta = ForecastParameters.DEFAULT_THETA;
  private final HoltWinters hw = new HoltWinters();
  private final Arima arima = new Arima();
  private final Sarima sarima = new Sarima();
  private final Prophet prophet = new Prophet();
  private final NeuralProphet neuralProphet = new NeuralProphet();
  private final Darts darts = new Darts();
  private final Cli cli = new Cli();

  /**
   * @throws IllegalArgumentException when a configured value is out of range or an order string
   *     is malformed
   */
  public ForecastParameters toParameters() {
    return new ForecastParameters(
        smaWindow,
        esAlpha,
        new ForecastParameters.HoltWinters(hw.getAlpha(), hw.getBeta(), hw.getGamma(),
            hw.getSeasonalPeriods()),
        theta,
        new ForecastParameters.Arima(arima.isEnabled(), ModelOrder.parse(arima.getOrder())),
        new ForecastParameters.Sarima(sarima.isEnabled(), ModelOrder.parse(sarima.getOrder()),
            SeasonalOrder.parse(sarima.getSeasonalOrder())),
        new ForecastParameters.Prophet(prophet.isEnabled(), prophet.isDailySeasonality(),
            prophet.isYearlySeasonality(), prophet.isWeeklySeasonality(),
            prophet.getChangepointPriorScale(), prophet.getSeasonalityPriorScale()),
        new ForecastParameters.NeuralProphet(neuralProphet.isEnabled()),
        new ForecastParameters.Darts(darts.isEnabled(), DartsModel.fromCode(darts.getModel())));
  }

  public int getSmaWindow() {
    return smaWindow;
  }

  public void setSmaWindow(int smaWindow) {
    this.smaWindow = smaWindow;
  }

  public double getEsAlpha() {
    return esAlpha;
  }

  public void setEsAlpha(double esAlpha) {
    this.esAlpha = esAlpha;
  }

  public double getTheta() {
    return theta;
  }

  public void setTheta(double theta) {
    this.theta = theta;
  }

  public HoltWinters getHw() {
    return hw;
  }

  public Arima getArima() {
    return arima;
  }

  public Sarima getSarima() {
    return sarima;
  }

  public Prophet getProphet() {
    return prophet;
  }

  public NeuralProphet getNeuralProphet() {
    return neuralProphet;
  }

  public Darts getDarts() {
    return darts;
  }

  public Cli getCli() {
    return cli;
  }

  public static class HoltWinters {
    private double alpha = ForecastParameters.HoltWinters.DEFAULT_ALPHA;
    private double beta = ForecastParameters.HoltWinters.DEFAULT_BETA;
    private double gamma = ForecastParameters.HoltWinters.DEFAULT_GAMMA;
    private int seasonalPeriods = ForecastParameters.HoltWinters.DEFAULT_SEASONAL_PERIODS;

    public double getAlpha() {
      return alpha;
    }

    public void setAlpha(double alpha) {
      this.alpha = alpha;
    }

    public double getBeta() {
      return beta;
    }

    public void setBeta(double beta) {
      this.beta = beta;
    }

    public double getGamma() {
      return gamma;
    }

    public void setGamma(double gamma) {
      this.gamma = gamma;
    }

    public int getSeasonalPeriods() {
      return seasonalPeriods;
    }

    public void setSeasonalPeriods(int seasonalPeriods) {
      this.seasonalPeriods = seasonalPeriods;
    }
  }

  public static class Arima {
    private boolean enabled;
    private String order = "1,1,1";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getOrder() {
      return order;
    }

    public void setOrder(String order) {
      this.order = order;
    }
  }

  public static class Sarima {
    private boolean enabled;
    private String order = "1,1,1";
    private String seasonalOrder = "1,1,1,12";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getOrder() {
      return order;
    }

    public void setOrder(String order) {
      this.order = order;
    }

    public String getSeasonalOrder() {
      return seasonalOrder;
    }

    public void setSeasonalOrder(String seasonalOrder) {
      this.seasonalOrder = seasonalOrder;
    }
  }

  public static class Prophet {
    private boolean enabled = true;
    private boolean dailySeasonality = true;
    private boolean yearlySeasonality = true;
    private boolean weeklySeasonality;
    private double changepointPriorScale = 0.05;
    private double seasonalityPriorScale = 10.0;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isDailySeasonality() {
      return dailySeasonality;
    }

    public void setDailySeasonality(boolean dailySeasonality) {
      this.dailySeasonality = dailySeasonality;
    }

    public boolean isYearlySeasonality() {
      return yearlySeasonality;
    }

    public void setYearlySeasonality(boolean yearlySeasonality) {
      this.yearlySeasonality = yearlySeasonality;
    }

    public boolean isWeeklySeasonality() {
      return weeklySeasonality;
    }

    public void setWeeklySeasonality(boolean weeklySeasonality) {
      this.weeklySeasonality = weeklySeasonality;
    }

    public double getChangepointPriorScale() {
      return changepointPriorScale;
    }

    public void setChangepointPriorScale(double changepointPriorScale) {
      this.changepointPriorScale = changepointPriorScale;
    }

    public double getSeasonalityPriorScale() {
      return seasonalityPriorScale;
    }

    public void setSeasonalityPriorScale(double seasonalityPriorScale) {
      this.seasonalityPriorScale = seasonalityPriorScale;
    }
  }

  public static class NeuralProphet {
    private boolean enabled;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }

  public static class Darts {
    private boolean enabled;
    private String model = DartsModel.EXPONENTIAL_SMOOTHING.code();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }
  }

  /** Settings of the {@code cli} profile. */
  public static class Cli {
    private String input;
    private String output;
    private String dateColumn = "date";
    private String valueColumn = "value";
    private boolean ensemble;
    private boolean milestoneSummary;

    public String getInput() {
      return input;
    }

    public void setInput(String input) {
      this.input = input;
    }

    public String getOutput() {
      return output;
    }

    public void setOutput(String output) {
      this.output = output;
    }

    public String getDateColumn() {
      return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
      this.dateColumn = dateColumn;
    }

    public String getValueColumn() {
      return valueColumn;
    }

    public void setValueColumn(String valueColumn) {
      this.valueColumn = valueColumn;
    }

    public boolean isEnsemble() {
      return ensemble;
    }

    public void setEnsemble(boolean ensemble) {
      this.ensemble = ensemble;
    }

    public boolean isMilestoneSummary() {
      return milestoneSummary;
    }

    public void setMilestoneSummary(boolean milestoneSummary) {
      this.milestoneSummary = milestoneSummary;
    }
  }
}
