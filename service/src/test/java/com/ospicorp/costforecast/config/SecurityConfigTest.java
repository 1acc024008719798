package com.ospicorp.costforecast.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
    "security.auth.enabled=true",
    "spring.security.oauth2.resourceserver.jwt.jwk-set-uri=http://localhost:1/.well-known/jwks.json"
})
class SecurityConfigTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void livenessStaysPublic() {
    ResponseEntity<String> response = rest.getForEntity("/v1/ping", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getCacheControl()).contains("no-store");
  }

  @Test
  void forecastsRequireABearerToken() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    ResponseEntity<String> post = rest.exchange("/v1/forecasts", HttpMethod.POST,
        new HttpEntity<>(Map.of("points", List.of()), headers), String.class);
    ResponseEntity<String> catalogue = rest.getForEntity("/v1/forecasts/algorithms",
        String.class);

    assertThat(post.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(catalogue.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(catalogue.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE))
        .startsWith("Bearer");
  }
}
