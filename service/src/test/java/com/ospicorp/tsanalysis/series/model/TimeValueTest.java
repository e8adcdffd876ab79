package com.ospicorp.tsanalysis.series.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeValueTest {

  @Test
  void numericTextStaysNumeric() {
    TimeValue value = TimeValue.of("2.5");

    assertThat(value.kind()).isEqualTo(TimeValue.Kind.NUMERIC);
    assertThat(value.isNumeric()).isTrue();
    assertThat(value.axisValue()).isEqualTo(2.5);
  }

  @Test
  void integralNumbersRenderWithoutFraction() {
    assertThat(TimeValue.of(3).render()).isEqualTo("3");
    assertThat(TimeValue.of("0.25").render()).isEqualTo("0.25");
  }

  @Test
  void isoTimestampsBecomeInstants() {
    assertThat(TimeValue.of("2024-01-01T00:00:01Z").instant())
        .isEqualTo(Instant.parse("2024-01-01T00:00:01Z"));
    assertThat(TimeValue.of("2024-01-01 12:30:00").instant())
        .isEqualTo(Instant.parse("2024-01-01T12:30:00Z"));
    assertThat(TimeValue.of("2024-03-05").instant())
        .isEqualTo(Instant.parse("2024-03-05T00:00:00Z"));
    assertThat(TimeValue.of(LocalDate.of(2024, 3, 5)).isInstant()).isTrue();
  }

  @Test
  void instantAxisIsEpochSeconds() {
    assertThat(TimeValue.of("1970-01-01T00:01:00Z").axisValue()).isEqualTo(60.0);
  }

  @Test
  void unparseableTextIsKeptVerbatim() {
    TimeValue label = TimeValue.of(" week 3 ");

    assertThat(label.kind()).isEqualTo(TimeValue.Kind.TEXT);
    assertThat(label.render()).isEqualTo("week 3");
    assertThat(label.axisValue()).isNull();
    assertThat(TimeValue.of("2024-13-45").kind()).isEqualTo(TimeValue.Kind.TEXT);
  }

  @Test
  void rejectsMissingAndNonFiniteValues() {
    assertThatThrownBy(() -> TimeValue.of(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TimeValue.of("  ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TimeValue.ofNumber(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void jsonKeepsTheKind() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    List<TimeValue> values = List.of(TimeValue.of(1), TimeValue.of("2024-01-01T00:00:00Z"),
        TimeValue.of("Q1"));

    String json = mapper.writeValueAsString(values);
    List<TimeValue> back = mapper.readValue(json, new TypeReference<List<TimeValue>>() {});

    assertThat(json).isEqualTo("[1.0,\"2024-01-01T00:00:00Z\",\"Q1\"]");
    assertThat(back).isEqualTo(values);
  }
}
