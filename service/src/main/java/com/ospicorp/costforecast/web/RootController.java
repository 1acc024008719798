package com.ospicorp.costforecast.web;

import com.ospicorp.costforecast.forecast.model.Algorithm;
import com.ospicorp.costforecast.forecast.service.ForecasterRegistry;
import com.ospicorp.costforecast.forecast.service.OutputAssembler;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness plus a short description of how this instance forecasts. */
@RestController
public class RootController {

  private final ForecasterRegistry registry;
  private final String backendType;

  public RootController(ForecasterRegistry registry,
      @Value("${forecast.backend.type:none}") String backendType) {
    this.registry = registry;
    this.backendType = backendType;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    List<String> methods = new ArrayList<>();
    for (Algorithm algorithm : OutputAssembler.columns(registry.available())) {
      methods.add(algorithm.column());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "cost-forecast");
    body.put("status", "ok");
    body.put("backend", backendType);
    body.put("methods", methods);
    body.put("docs", "/swagger-ui.html");
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
