package com.ospicorp.costforecast.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProblemDetailsHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<Map<String, Object>> post(String body, MediaType contentType) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(contentType);
    return rest.exchange("/v1/forecasts", HttpMethod.POST, new HttpEntity<>(body, headers),
        new ParameterizedTypeReference<Map<String, Object>>() {});
  }

  @Test
  void unreadableBodyReturnsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = post("{\"points\": [",
        MediaType.APPLICATION_JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body)
        .containsEntry("type", "https://docs.cost-forecast.dev/problems/invalid-input");
  }

  @Test
  void missingPointsFailsValidation() {
    ResponseEntity<Map<String, Object>> response = post("{\"ensemble\": true}",
        MediaType.APPLICATION_JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("instance", "/v1/forecasts");
  }

  @Test
  void unsupportedContentTypeIsRejected() {
    ResponseEntity<Map<String, Object>> response = post("points", MediaType.TEXT_PLAIN);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    assertThat(response.getBody())
        .containsEntry("type", "https://docs.cost-forecast.dev/problems/unsupported-media-type");
  }
}
