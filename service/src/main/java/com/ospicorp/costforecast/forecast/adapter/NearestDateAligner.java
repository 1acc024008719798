package com.ospicorp.costforecast.forecast.adapter;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps backend output onto the requested horizon. Each horizon date takes the value of the backend
 * point closest in days; ties go to the earlier backend date and the first of duplicated backend
 * dates wins.
 */
public final class NearestDateAligner {

  private NearestDateAligner() {}

  public static List<Double> align(List<BackendPoint> points, List<LocalDate> horizon) {
    TreeMap<LocalDate, Double> byDate = new TreeMap<>();
    for (BackendPoint point : points) {
      if (point.date() != null) {
        byDate.putIfAbsent(point.date(), point.value());
      }
    }

    List<Double> aligned = new ArrayList<>(horizon.size());
    for (LocalDate date : horizon) {
      aligned.add(nearest(byDate, date));
    }
    return aligned;
  }

  private static Double nearest(TreeMap<LocalDate, Double> byDate, LocalDate date) {
    Map.Entry<LocalDate, Double> floor = byDate.floorEntry(date);
    Map.Entry<LocalDate, Double> ceiling = byDate.ceilingEntry(date);
    if (floor == null && ceiling == null) {
      return null;
    }
    if (floor == null) {
      return ceiling.getValue();
    }
    if (ceiling == null) {
      return floor.getValue();
    }
    long below = ChronoUnit.DAYS.between(floor.getKey(), date);
    long above = ChronoUnit.DAYS.between(date, ceiling.getKey());
    return above < below ? ceiling.getValue() : floor.getValue();
  }
}
