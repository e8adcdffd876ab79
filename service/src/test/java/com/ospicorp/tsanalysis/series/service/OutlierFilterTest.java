package com.ospicorp.tsanalysis.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import com.ospicorp.tsanalysis.series.model.RawTable;
import com.ospicorp.tsanalysis.series.model.TimeSeries;
import com.ospicorp.tsanalysis.series.model.TimeValue;
import com.ospicorp.tsanalysis.series.model.enums.OutlierMethod;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutlierFilterTest {

  private static TimeSeries single(String... values) {
    Object[][] rows = new Object[values.length][];
    for (int i = 0; i < values.length; i++) {
      rows[i] = new Object[] {String.valueOf(i), values[i]};
    }
    return TimeSeriesFactory.create(RawTable.of(List.of("t", "v"), rows), "t", null);
  }

  private static List<TimeValue> times(int... indexes) {
    return Arrays.stream(indexes).mapToObj(i -> TimeValue.ofNumber(i)).toList();
  }

  @Test
  void iqrDropsRowsOutsideTheFences() {
    TimeSeries out = OutlierFilter.remove(single("1", "2", "3", "4", "100"), OutlierMethod.IQR,
        1.5, null);

    assertEquals(List.of(1d, 2d, 3d, 4d), out.column("v"));
    assertEquals(times(0, 1, 2, 3), out.times());
  }

  @Test
  void rowsWithMissingValuesAreKept() {
    TimeSeries out = OutlierFilter.remove(single("1", "", "2", "3", "4", "100"),
        OutlierMethod.IQR, 1.5, null);

    assertEquals(Arrays.asList(1d, null, 2d, 3d, 4d), out.column("v"));
  }

  @Test
  void laterColumnsAreCheckedAgainstTheSurvivingRows() {
    TimeSeries series = TimeSeriesFactory.create(RawTable.of(List.of("t", "a", "b"),
        new Object[] {"0", "1", "10"},
        new Object[] {"1", "2", "11"},
        new Object[] {"2", "3", "12"},
        new Object[] {"3", "4", "13"},
        new Object[] {"4", "5", "30"},
        new Object[] {"5", "100", "0"}), "t", null);

    TimeSeries out = OutlierFilter.remove(series, OutlierMethod.IQR, 1.5, null);

    assertEquals(times(0, 1, 2, 3), out.times());
    assertEquals(List.of(10d, 11d, 12d, 13d), out.column("b"));
  }

  @Test
  void zscoreUsesSampleStandardDeviation() {
    TimeSeries series = single("10", "10", "10", "10", "10", "10", "10", "10", "10", "50");

    // z of the spike is about 2.85
    assertEquals(9, OutlierFilter.remove(series, OutlierMethod.ZSCORE, 2, null).size());
    assertEquals(10, OutlierFilter.remove(series, OutlierMethod.ZSCORE, 3, null).size());
  }

  @Test
  void zscoreLeavesConstantColumnsAlone() {
    TimeSeries series = single("4", "4", "4");

    assertEquals(3, OutlierFilter.remove(series, OutlierMethod.ZSCORE, 0.1, null).size());
  }

  @Test
  void percentileKeepsTheCentralFraction() {
    TimeSeries out = OutlierFilter.remove(
        single("1", "2", "3", "4", "5", "6", "7", "8", "9", "10"), OutlierMethod.PERCENTILE,
        0.8, null);

    assertEquals(List.of(2d, 3d, 4d, 5d, 6d, 7d, 8d, 9d), out.column("v"));
  }

  @Test
  void onlyNamedColumnsAreChecked() {
    TimeSeries series = TimeSeriesFactory.create(RawTable.of(List.of("t", "a", "b"),
        new Object[] {"0", "1", "1"},
        new Object[] {"1", "2", "2"},
        new Object[] {"2", "3", "3"},
        new Object[] {"3", "4", "400"}), "t", null);

    assertEquals(4, OutlierFilter.remove(series, OutlierMethod.IQR, 1.5, List.of("a")).size());
    assertEquals(3, OutlierFilter.remove(series, OutlierMethod.IQR, 1.5, List.of("b")).size());
  }

  @Test
  void rejectsUnusableThresholds() {
    TimeSeries series = single("1", "2");

    assertThrows(TimeSeriesValidationException.class,
        () -> OutlierFilter.remove(series, OutlierMethod.IQR, 0, null));
    assertThrows(TimeSeriesValidationException.class,
        () -> OutlierFilter.remove(series, OutlierMethod.PERCENTILE, 1.5, null));
  }
}
