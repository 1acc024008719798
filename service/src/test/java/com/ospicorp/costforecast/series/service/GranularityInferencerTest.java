package com.ospicorp.costforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.costforecast.series.model.Granularity;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GranularityInferencerTest {

  @Test
  void firstOfMonthDatesAreMonthly() {
    var dates = List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1),
        LocalDate.of(2024, 3, 1));
    assertEquals(Granularity.MONTHLY, GranularityInferencer.infer(dates));
  }

  @Test
  void consecutiveDaysAreDaily() {
    var dates = List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2),
        LocalDate.of(2024, 1, 3));
    assertEquals(Granularity.DAILY, GranularityInferencer.infer(dates));
  }

  @Test
  void monthEndsWithMonthlyStepAreMonthly() {
    var dates = List.of(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 29),
        LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 30));
    assertEquals(Granularity.MONTHLY, GranularityInferencer.infer(dates));
  }

  @Test
  void sameMidMonthDayEachMonthIsDaily() {
    List<LocalDate> dates = new ArrayList<>();
    for (int month = 1; month <= 12; month++) {
      dates.add(LocalDate.of(2024, month, 15));
    }
    assertEquals(Granularity.DAILY, GranularityInferencer.infer(dates));
  }

  @Test
  void monthEndsSkippingAMonthAreDaily() {
    var dates = List.of(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 3, 31),
        LocalDate.of(2024, 5, 31));
    assertEquals(Granularity.DAILY, GranularityInferencer.infer(dates));
  }

  @Test
  void irregularSpacingDefaultsToDaily() {
    var dates = List.of(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 2, 15),
        LocalDate.of(2024, 4, 15));
    assertEquals(Granularity.DAILY, GranularityInferencer.infer(dates));
    assertEquals(Granularity.DAILY, GranularityInferencer.infer(List.of()));
  }
}
