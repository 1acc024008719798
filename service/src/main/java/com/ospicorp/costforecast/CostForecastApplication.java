package com.ospicorp.costforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CostForecastApplication {

  public static void main(String[] args) {
    ConfigurableApplicationContext context =
        SpringApplication.run(CostForecastApplication.class, args);
    if (context.getEnvironment().acceptsProfiles(Profiles.of("cli"))) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
