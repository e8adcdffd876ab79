package com.ospicorp.tsanalysis.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.RawTable;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import com.ospicorp.tsanalysis.series.model.enums.Aggregation;
import com.ospicorp.tsanalysis.series.model.enums.ResampleFrequency;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeSeriesResamplerTest {

  private static final TimeSeries READINGS = TimeSeriesFactory.create(
      RawTable.of(List.of("at", "v"),
          new Object[] {"2024-01-01 06:00", "1"},
          new Object[] {"2024-01-01 18:00", "3"},
          new Object[] {"2024-01-03 00:00", "5"}), "at", null);

  private static TimeValue at(String instant) {
    return TimeValue.ofInstant(Instant.parse(instant));
  }

  @Test
  void dailyMeanLeavesEmptyDaysMissing() {
    TimeSeries out = TimeSeriesResampler.resample(READINGS, ResampleFrequency.DAY,
        Aggregation.MEAN);

    assertEquals(List.of(at("2024-01-01T00:00:00Z"), at("2024-01-02T00:00:00Z"),
        at("2024-01-03T00:00:00Z")), out.times());
    assertEquals(Arrays.asList(2d, null, 5d), out.column("v"));
    assertEquals(READINGS.id(), out.id());
  }

  @Test
  void sumOfAnEmptyBucketIsZero() {
    TimeSeries out = TimeSeriesResampler.resample(READINGS, ResampleFrequency.DAY,
        Aggregation.SUM);

    assertEquals(List.of(4d, 0d, 5d), out.column("v"));
  }

  @Test
  void monthlyBucketsAreLabelledByMonthEnd() {
    TimeSeries series = TimeSeriesFactory.create(RawTable.of(List.of("day", "v"),
        new Object[] {"2024-01-15", "1"},
        new Object[] {"2024-01-20", "7"},
        new Object[] {"2024-02-01", "3"}), "day", null);

    TimeSeries out = TimeSeriesResampler.resample(series, ResampleFrequency.MONTH,
        Aggregation.MAX);

    assertEquals(List.of(at("2024-01-31T00:00:00Z"), at("2024-02-29T00:00:00Z")), out.times());
    assertEquals(List.of(7d, 3d), out.column("v"));
  }

  @Test
  void weeksEndOnSunday() {
    TimeSeries series = TimeSeriesFactory.create(RawTable.of(List.of("day", "v"),
        new Object[] {"2024-01-01", "2"},
        new Object[] {"2024-01-07", "4"},
        new Object[] {"2024-01-08", "6"}), "day", null);

    TimeSeries out = TimeSeriesResampler.resample(series, ResampleFrequency.WEEK,
        Aggregation.MEDIAN);

    assertEquals(List.of(at("2024-01-07T00:00:00Z"), at("2024-01-14T00:00:00Z")), out.times());
    assertEquals(List.of(3d, 6d), out.column("v"));
  }

  @Test
  void missingCellsDoNotCountTowardsTheAggregate() {
    TimeSeries series = TimeSeriesFactory.create(RawTable.of(List.of("at", "v"),
        new Object[] {"2024-01-01 00:10", "4"},
        new Object[] {"2024-01-01 00:40", ""},
        new Object[] {"2024-01-01 01:05", ""}), "at", null);

    TimeSeries out = TimeSeriesResampler.resample(series, ResampleFrequency.HOUR,
        Aggregation.MIN);

    assertEquals(Arrays.asList(4d, null), out.column("v"));
  }

  @Test
  void numericTimeAxisCannotBeResampled() {
    TimeSeries numeric = TimeSeriesFactory.create(RawTable.of(List.of("t", "v"),
        new Object[] {"0", "1"}), "t", null);

    assertThrows(TimeSeriesValidationException.class,
        () -> TimeSeriesResampler.resample(numeric, ResampleFrequency.DAY, Aggregation.MEAN));
  }
}
