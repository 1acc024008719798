package com.ospicorp.costforecast.forecast.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/** Posts the request to a forecasting service, e.g. a small Flask app wrapping Prophet. */
@Component
@ConditionalOnProperty(name = "forecast.backend.type", havingValue = "http")
public class HttpForecastBackend implements ForecastBackend {

  private final RestTemplate restTemplate;
  private final String url;

  public HttpForecastBackend(RestTemplate restTemplate,
      @Value("${forecast.backend.http.url:http://localhost:5002/forecast}") String url) {
    this.restTemplate = restTemplate;
    this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  @Override
  public String name() {
    return "http backend (" + url + ")";
  }

  @Override
  public List<BackendPoint> forecast(BackendRequest request) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<BackendRequest> entity = new HttpEntity<>(request, headers);
    String target = url + '/' + request.algorithm();
    try {
      ResponseEntity<JsonNode> response = restTemplate.exchange(target, HttpMethod.POST, entity,
          JsonNode.class);
      return BackendResponses.parse(response.getBody(), request.algorithm());
    } catch (ResourceAccessException ex) {
      throw new BackendUnavailableException(target + " is not reachable: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      throw new BackendException(target + " failed: " + ex.getMessage(), ex);
    }
  }
}
