package com.ospicorp.costforecast.config;

import com.ospicorp.costforecast.forecast.model.ForecastParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ForecastConfig {

  private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

  /** Configured defaults; a bad value stops the application at startup. */
  @Bean
  ForecastParameters defaultForecastParameters(ForecastProperties properties) {
    ForecastParameters parameters = properties.toParameters();
    log.info("Forecast defaults: sma window {}, es alpha {}, holt-winters {}, theta {},"
            + " arima {}, sarima {}, prophet {}, neural prophet {}, darts {}",
        parameters.smaWindow(), parameters.esAlpha(), parameters.holtWinters(),
        parameters.theta(), enabled(parameters.arima().enabled()),
        enabled(parameters.sarima().enabled()), enabled(parameters.prophet().enabled()),
        enabled(parameters.neuralProphet().enabled()), enabled(parameters.darts().enabled()));
    return parameters;
  }

  private static String enabled(boolean flag) {
    return flag ? "on" : "off";
  }
}
