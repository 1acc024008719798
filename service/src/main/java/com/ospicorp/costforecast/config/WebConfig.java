package com.ospicorp.costforecast.config;

import com.ospicorp.costforecast.forecast.controller.CsvHttpMessageConverter;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig {

  /** Client for the http forecast backend. */
  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${forecast.backend.http.connect-timeout:PT5S}") Duration connectTimeout,
      @Value("${forecast.backend.http.read-timeout:PT2M}") Duration readTimeout) {
    return builder
        .setConnectTimeout(connectTimeout)
        .setReadTimeout(readTimeout)
        .build();
  }

  @Configuration
  @ConditionalOnWebApplication
  static class CsvConverterConfig implements WebMvcConfigurer {

    @Override
    public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
      converters.add(0, new CsvHttpMessageConverter());
    }
  }
}
