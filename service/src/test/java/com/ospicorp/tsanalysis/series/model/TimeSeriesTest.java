package com.ospicorp.tsanalysis.series.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tsanalysis.series.TimeSeriesValidationException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimeSeriesTest {

  private static final List<TimeValue> TIMES =
      List.of(TimeValue.of(0), TimeValue.of(1), TimeValue.of(2));

  @Test
  void keepsColumnOrderAndNulls() {
    TimeSeries series = new TimeSeries("id-1", null, null, "t", List.of("b", "a"), TIMES,
        Map.of("a", Arrays.asList(1d, null, 3d), "b", List.of(4d, 5d, 6d)), null, null);

    assertThat(series.columns()).containsExactly("t", "b", "a");
    assertThat(series.values().keySet()).containsExactly("b", "a");
    assertThat(series.column("a")).containsExactly(1d, null, 3d);
    assertThat(series.size()).isEqualTo(3);
  }

  @Test
  void rejectsMisalignedColumns() {
    assertThatThrownBy(() -> new TimeSeries(null, null, null, "t", List.of("a"), TIMES,
        Map.of("a", List.of(1d, 2d)), null, null))
        .isInstanceOf(TimeSeriesValidationException.class)
        .hasMessageContaining("has 2 values");
  }

  @Test
  void rejectsTimeColumnAmongValueColumns() {
    assertThatThrownBy(() -> new TimeSeries(null, null, null, "t", List.of("t"), TIMES,
        Map.of("t", List.of(1d, 2d, 3d)), null, null))
        .isInstanceOf(TimeSeriesValidationException.class);
  }

  @Test
  void rejectsEmptyValueColumns() {
    assertThatThrownBy(() -> new TimeSeries(null, null, null, "t", List.of(), TIMES, Map.of(),
        null, null))
        .isInstanceOf(TimeSeriesValidationException.class);
  }

  @Test
  void rejectsValuesForUndeclaredColumns() {
    assertThatThrownBy(() -> new TimeSeries(null, null, null, "t", List.of("a"), TIMES,
        Map.of("a", List.of(1d, 2d, 3d), "b", List.of(1d, 2d, 3d)), null, null))
        .isInstanceOf(TimeSeriesValidationException.class);
  }

  @Test
  void sameDataIgnoresIdentity() {
    TimeSeries first = new TimeSeries("one", "x", null, "t", List.of("a"), TIMES,
        Map.of("a", List.of(1d, 2d, 3d)), null, null);
    TimeSeries second = first.withId("two");

    assertThat(first.hasSameData(second)).isTrue();
    assertThat(first.hasSameData(first.withValues(Map.of("a", List.of(1d, 2d, 4d))))).isFalse();
  }
}
