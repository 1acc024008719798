package com.ospicorp.costforecast.forecast.adapter;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessForecastBackendTest {

  private final ObjectMapper mapper = Jackson2ObjectMapperBuilder.json().build();

  @TempDir
  Path dir;

  private final BackendRequest request = new BackendRequest("prophet", "daily",
      List.of(new BackendPoint(LocalDate.of(2024, 1, 1), 10d),
          new BackendPoint(LocalDate.of(2024, 1, 2), 11d)),
      List.of(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 4)),
      Map.of("weekly_seasonality", false));

  private Path script(String body) throws IOException {
    Path script = dir.resolve("backend.sh");
    Files.writeString(script, body, StandardCharsets.UTF_8);
    return script;
  }

  // well past the 64 KB a pipe buffers
  private static BackendRequest largeRequest() {
    List<BackendPoint> history = new ArrayList<>();
    LocalDate start = LocalDate.of(2010, 1, 1);
    for (int i = 0; i < 5000; i++) {
      history.add(new BackendPoint(start.plusDays(i), 1000d + i));
    }
    return new BackendRequest("prophet", "daily", history,
        List.of(start.plusDays(5000)), Map.of());
  }

  private ProcessForecastBackend backend(Path script, Duration timeout) {
    return new ProcessForecastBackend(mapper, "sh", script.toString(), timeout);
  }

  @Test
  void writesRequestToStdinAndReadsForecastFromStdout() throws Exception {
    Path captured = dir.resolve("request.json");
    Path script = script("cat > '" + captured + "'\n"
        + "echo '{\"status\": \"ok\", \"forecast\": ["
        + "{\"ds\": \"2024-01-03\", \"yhat\": NaN}, {\"ds\": \"2024-01-04\", \"yhat\": 2.5}]}'\n");

    var points = backend(script, Duration.ofSeconds(20)).forecast(request);

    assertEquals(2, points.size());
    assertTrue(points.get(0).value().isNaN());
    assertEquals(new BackendPoint(LocalDate.of(2024, 1, 4), 2.5), points.get(1));
    var sent = mapper.readTree(captured.toFile());
    assertEquals("prophet", sent.path("algorithm").asText());
    assertEquals("2024-01-01", sent.path("history").get(0).path("ds").asText());
    assertEquals(11d, sent.path("history").get(1).path("y").asDouble());
    assertEquals("2024-01-04", sent.path("horizon").get(1).asText());
    assertFalse(sent.path("options").path("weekly_seasonality").asBoolean(true));
  }

  @Test
  void scriptReceivesTheAlgorithmAsArgument() throws Exception {
    Path script = script("cat > /dev/null\n"
        + "echo \"{\\\"status\\\": \\\"ok\\\", \\\"forecast\\\": "
        + "[{\\\"ds\\\": \\\"2024-01-03\\\", \\\"y\\\": ${#1}}]}\"\n");

    var points = backend(script, Duration.ofSeconds(20)).forecast(request);

    assertEquals(7d, points.get(0).value());
  }

  @Test
  void nonZeroExitIsAFailureCarryingStderr() throws Exception {
    Path script = script("cat > /dev/null\necho 'model exploded' >&2\nexit 3\n");

    var ex = assertThrows(BackendException.class,
        () -> backend(script, Duration.ofSeconds(20)).forecast(request));

    assertFalse(ex instanceof BackendUnavailableException);
    assertTrue(ex.getMessage().contains("exited with code 3"));
    assertTrue(ex.getMessage().contains("model exploded"));
  }

  @Test
  void unavailableStatusFromScriptIsUnavailable() throws Exception {
    Path script = script("cat > /dev/null\n"
        + "echo '{\"status\": \"unavailable\", \"message\": \"prophet not installed\"}'\n");

    assertThrows(BackendUnavailableException.class,
        () -> backend(script, Duration.ofSeconds(20)).forecast(request));
  }

  @Test
  void slowScriptTimesOut() throws Exception {
    Path script = script("cat > /dev/null\nsleep 5\n");

    var ex = assertThrows(BackendException.class,
        () -> backend(script, Duration.ofMillis(300)).forecast(request));

    assertTrue(ex.getMessage().contains("did not finish"));
  }

  @Test
  void scriptIgnoringALargeRequestStillTimesOut() throws Exception {
    Path script = script("sleep 20\n");
    var backend = backend(script, Duration.ofSeconds(1));
    var large = largeRequest();

    var ex = assertTimeoutPreemptively(Duration.ofSeconds(10),
        () -> assertThrows(BackendException.class, () -> backend.forecast(large)));

    assertTrue(ex.getMessage().contains("did not finish"));
  }

  @Test
  void callsBeyondTheProcessLimitAreUnavailable() throws Exception {
    Path script = script("sleep 3\n");
    var backend = backend(script, Duration.ofSeconds(10));
    var large = largeRequest();
    ExecutorService callers = Executors.newFixedThreadPool(
        ProcessForecastBackend.MAX_CONCURRENT_PROCESSES);
    try {
      List<Future<?>> running = new ArrayList<>();
      for (int i = 0; i < ProcessForecastBackend.MAX_CONCURRENT_PROCESSES; i++) {
        running.add(callers.submit(() -> backend.forecast(large)));
      }
      Thread.sleep(1000);

      var ex = assertThrows(BackendUnavailableException.class, () -> backend.forecast(large));

      assertTrue(ex.getMessage().contains("Too many concurrent"));
      assertEquals(ProcessForecastBackend.MAX_CONCURRENT_PROCESSES, running.size());
    } finally {
      callers.shutdownNow();
      backend.destroy();
    }
  }

  @Test
  void missingCommandIsUnavailable() throws Exception {
    var backend = new ProcessForecastBackend(mapper, dir.resolve("no-such-python").toString(),
        "forecast.py", Duration.ofSeconds(5));

    assertThrows(BackendUnavailableException.class, () -> backend.forecast(request));
  }
}
