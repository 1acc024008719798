package com.ospicorp.costforecast.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Cost Forecast API")
            .version("v1")
            .description("Multi-method cost forecasting with ensemble estimates and calendar"
                + " milestone totals")
            .contact(new Contact().name("FinOps Platform Team").email("finops-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Forecasting guide")
            .url("https://docs.cost-forecast.dev"));
  }
}
