package com.ospicorp.costforecast.forecast.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs a forecasting script as a child process. The request is written to stdin as JSON and the
 * reply is read from stdout; the script is invoked as {@code <command> <script> <algorithm>}.
 *
 * <p>Exit code 0 means the reply on stdout is authoritative. Any other exit code, a timeout or an
 * unreadable reply is a backend failure. A command that cannot be started is reported as
 * unavailable.
 *
 * <p>Each call uses three pipe threads (stdin, stdout, stderr) from a bounded pool, so at most
 * {@value #MAX_CONCURRENT_PROCESSES} scripts run at once; further calls fail fast as unavailable.
 */
@Component
@ConditionalOnProperty(name = "forecast.backend.type", havingValue = "process")
public class ProcessForecastBackend implements ForecastBackend, DisposableBean {

  static final int MAX_CONCURRENT_PROCESSES = 8;

  private static final Logger log = LoggerFactory.getLogger(ProcessForecastBackend.class);

  private final ObjectMapper mapper;
  private final String command;
  private final String script;
  private final Duration timeout;
  private final ThreadPoolTaskExecutor pipes;

  public ProcessForecastBackend(ObjectMapper mapper,
      @Value("${forecast.backend.process.command:python3}") String command,
      @Value("${forecast.backend.process.script:scripts/forecast_backend.py}") String script,
      @Value("${forecast.backend.process.timeout:PT2M}") Duration timeout) {
    this.mapper = mapper;
    this.command = command;
    this.script = script;
    this.timeout = timeout;
    this.pipes = new ThreadPoolTaskExecutor();
    pipes.setCorePoolSize(3);
    pipes.setMaxPoolSize(3 * MAX_CONCURRENT_PROCESSES);
    pipes.setQueueCapacity(0);
    pipes.setDaemon(true);
    pipes.setThreadNamePrefix("forecast-pipe-");
    pipes.initialize();
  }

  @Override
  public void destroy() {
    pipes.shutdown();
  }

  @Override
  public String name() {
    return "process backend (" + command + " " + script + ")";
  }

  @Override
  public List<BackendPoint> forecast(BackendRequest request) {
    byte[] payload;
    try {
      payload = mapper.writeValueAsBytes(request);
    } catch (JsonProcessingException ex) {
      throw new BackendException("Unable to serialize the backend request", ex);
    }

    long deadline = System.nanoTime() + timeout.toNanos();
    Process process;
    try {
      process = new ProcessBuilder(command, script, request.algorithm()).start();
    } catch (IOException ex) {
      throw new BackendUnavailableException("Unable to start " + command + ": " + ex.getMessage(),
          ex);
    }

    try {
      CompletableFuture<String> stdout;
      CompletableFuture<String> stderr;
      CompletableFuture<Void> stdin;
      try {
        stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), pipes);
        stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), pipes);
        // a child that never reads stdin must not block past the deadline
        stdin = CompletableFuture.runAsync(() -> writeFully(process.getOutputStream(), payload),
            pipes);
      } catch (TaskRejectedException ex) {
        kill(process);
        throw new BackendUnavailableException(
            "Too many concurrent " + command + " processes, retry later", ex);
      }

      if (!process.waitFor(remaining(deadline), TimeUnit.NANOSECONDS)) {
        kill(process);
        throw new BackendException(request.algorithm() + " did not finish within " + timeout);
      }

      int exitCode = process.exitValue();
      stdin.exceptionally(ex -> {
        log.debug("{} closed stdin before reading the whole request for {}", command,
            request.algorithm(), ex);
        return null;
      });
      String errors = stderr.get(remaining(deadline), TimeUnit.NANOSECONDS);
      if (!errors.isBlank()) {
        log.debug("{} stderr for {}: {}", command, request.algorithm(), errors.strip());
      }
      if (exitCode != 0) {
        throw new BackendException(request.algorithm() + " script exited with code " + exitCode
            + (errors.isBlank() ? "" : ": " + errors.strip()));
      }

      // python's json module writes NaN for missing predictions
      JsonNode body = mapper.reader().with(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
          .readTree(stdout.get(remaining(deadline), TimeUnit.NANOSECONDS));
      return BackendResponses.parse(body, request.algorithm());
    } catch (IOException | ExecutionException ex) {
      kill(process);
      throw new BackendException("Communication with " + command + " failed: " + ex.getMessage(),
          ex);
    } catch (TimeoutException ex) {
      kill(process);
      throw new BackendException(request.algorithm() + " output was not complete within " + timeout,
          ex);
    } catch (InterruptedException ex) {
      kill(process);
      Thread.currentThread().interrupt();
      throw new BackendException("Interrupted while waiting for " + request.algorithm(), ex);
    }
  }

  private static long remaining(long deadline) {
    return Math.max(0L, deadline - System.nanoTime());
  }

  // the script's own children hold the pipes open after the shell dies
  private static void kill(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private static void writeFully(OutputStream stream, byte[] payload) {
    try (stream) {
      stream.write(payload);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static String readFully(InputStream stream) {
    try (stream) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
