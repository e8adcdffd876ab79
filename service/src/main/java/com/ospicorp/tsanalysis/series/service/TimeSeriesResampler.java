package com.ospicorp.tsanalysis.series.service;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import com.ospicorp.tsanalysis.series.model.enums.Aggregation;
import com.ospicorp.tsanalysis.series.model.enums.ResampleFrequency;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates a date/time-indexed series into fixed calendar buckets (UTC). Minute, hour and day
 * buckets are labelled by their start; week, month, quarter and year buckets by their last day,
 * weeks ending on Sunday. Buckets with no rows between the first and the last one are emitted
 * with a missing value, or 0 when summing.
 */
public final class TimeSeriesResampler {
  static final int MAX_BUCKETS = 1_000_000;

  private TimeSeriesResampler() {
  }

  public static TimeSeries resample(TimeSeries series, ResampleFrequency frequency,
      Aggregation aggregation) {
    if (series.size() == 0) {
      return series;
    }
    TreeMap<LocalDateTime, List<Integer>> rowsByBucket = new TreeMap<>();
    for (int i = 0; i < series.size(); i++) {
      TimeValue time = series.times().get(i);
      if (!time.isInstant()) {
        throw new TimeSeriesValidationException("resampling needs date/time values in column '"
            + series.timeColumn() + "', found '" + time.render() + "'");
      }
      LocalDateTime at = LocalDateTime.ofInstant(time.instant(), ZoneOffset.UTC);
      rowsByBucket.computeIfAbsent(bucket(at, frequency), k -> new ArrayList<>()).add(i);
    }

    List<TimeValue> times = new ArrayList<>();
    Map<String, List<Double>> values = new LinkedHashMap<>();
    series.valueColumns().forEach(c -> values.put(c, new ArrayList<>()));
    LocalDateTime last = rowsByBucket.lastKey();
    for (LocalDateTime b = rowsByBucket.firstKey(); !b.isAfter(last); b = next(b, frequency)) {
      if (times.size() >= MAX_BUCKETS) {
        throw new TimeSeriesValidationException("resampling to " + frequency.code()
            + " would produce more than " + MAX_BUCKETS + " rows");
      }
      times.add(TimeValue.ofInstant(b.toInstant(ZoneOffset.UTC)));
      List<Integer> rows = rowsByBucket.getOrDefault(b, List.of());
      for (String column : series.valueColumns()) {
        List<Double> cells = new ArrayList<>(rows.size());
        rows.forEach(r -> cells.add(series.column(column).get(r)));
        values.get(column).add(aggregate(ColumnStatistics.present(cells), aggregation));
      }
    }
    return series.withData(times, values);
  }

  private static Double aggregate(double[] present, Aggregation aggregation) {
    if (present.length == 0) {
      return aggregation == Aggregation.SUM ? 0d : null;
    }
    return switch (aggregation) {
      case MEAN -> ColumnStatistics.mean(present);
      case SUM -> {
        double sum = 0;
        for (double v : present) {
          sum += v;
        }
        yield sum;
      }
      case MEDIAN -> ColumnStatistics.median(present);
      case MIN -> ColumnStatistics.min(present);
      case MAX -> ColumnStatistics.max(present);
    };
  }

  private static LocalDateTime bucket(LocalDateTime at, ResampleFrequency frequency) {
    LocalDate date = at.toLocalDate();
    return switch (frequency) {
      case MINUTE -> at.truncatedTo(ChronoUnit.MINUTES);
      case HOUR -> at.truncatedTo(ChronoUnit.HOURS);
      case DAY -> date.atStartOfDay();
      case WEEK -> date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)).atStartOfDay();
      case MONTH -> date.with(TemporalAdjusters.lastDayOfMonth()).atStartOfDay();
      case QUARTER -> endOfQuarter(date).atStartOfDay();
      case YEAR -> date.with(TemporalAdjusters.lastDayOfYear()).atStartOfDay();
    };
  }

  private static LocalDateTime next(LocalDateTime bucket, ResampleFrequency frequency) {
    return switch (frequency) {
      case MINUTE -> bucket.plusMinutes(1);
      case HOUR -> bucket.plusHours(1);
      case DAY -> bucket.plusDays(1);
      case WEEK -> bucket.plusWeeks(1);
      case MONTH -> bucket.plusMonths(1).with(TemporalAdjusters.lastDayOfMonth());
      case QUARTER -> bucket.plusMonths(3).with(TemporalAdjusters.lastDayOfMonth());
      case YEAR -> bucket.plusYears(1).with(TemporalAdjusters.lastDayOfYear());
    };
  }

  private static LocalDate endOfQuarter(LocalDate date) {
    int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
    return LocalDate.of(date.getYear(), quarterEndMonth, 1)
        .with(TemporalAdjusters.lastDayOfMonth());
  }
}
