package com.ospicorp.costforecast.forecast.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the backend reply:
 * <pre>
 *   {"status": "ok", "forecast": [{"ds": "2024-01-01", "yhat": 12.5}, ...]}
 * </pre>
 * {@code status} may be {@code unavailable} or {@code error} with a {@code message}. Values are
 * read from {@code yhat}, or {@code y} when {@code yhat} is absent.
 */
final class BackendResponses {

  private BackendResponses() {}

  static List<BackendPoint> parse(JsonNode body, String backend) {
    if (body == null || !body.isObject()) {
      throw new BackendException(backend + " returned an empty or malformed response");
    }
    String status = body.path("status").asText("ok");
    String message = body.path("message").asText("no message");
    if ("unavailable".equalsIgnoreCase(status)) {
      throw new BackendUnavailableException(backend + " reported unavailable: " + message);
    }
    if (!"ok".equalsIgnoreCase(status) && !"success".equalsIgnoreCase(status)) {
      throw new BackendException(backend + " reported " + status + ": " + message);
    }

    JsonNode forecast = body.path("forecast");
    if (!forecast.isArray()) {
      throw new BackendException(backend + " response is missing the 'forecast' array");
    }
    List<BackendPoint> points = new ArrayList<>(forecast.size());
    for (JsonNode entry : forecast) {
      LocalDate date = parseDate(entry.path("ds").asText(null), backend);
      JsonNode value = entry.has("yhat") ? entry.get("yhat") : entry.get("y");
      Double number = value == null || value.isNull() || !value.isNumber()
          ? null : value.asDouble();
      points.add(new BackendPoint(date, number));
    }
    return points;
  }

  private static LocalDate parseDate(String text, String backend) {
    if (text == null || text.isBlank()) {
      throw new BackendException(backend + " returned a forecast entry without 'ds'");
    }
    // timestamps such as "2024-01-01 00:00:00" carry the date in the first ten characters
    String date = text.length() > 10 ? text.substring(0, 10) : text;
    try {
      return LocalDate.parse(date);
    } catch (DateTimeParseException ex) {
      throw new BackendException(backend + " returned an unreadable date: " + text, ex);
    }
  }
}
