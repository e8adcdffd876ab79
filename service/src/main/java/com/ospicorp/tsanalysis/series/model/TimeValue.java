package com.ospicorp.tsanalysis.series.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public final class TimeValue {

  public enum Kind { NUMERIC, INSTANT, TEXT }

  private static final Pattern NUMBER =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern LOOKS_LIKE_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");
  private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

  private final Kind kind;
  private final double number;
  private final Instant instant;
  private final String text;

  private TimeValue(Kind kind, double number, Instant instant, String text) {
    this.kind = kind;
    this.number = number;
    this.instant = instant;
    this.text = text;
  }

  public static TimeValue ofNumber(double number) {
    if (!Double.isFinite(number)) {
      throw new IllegalArgumentException("time value must be finite: " + number);
    }
    return new TimeValue(Kind.NUMERIC, number, null, null);
  }

  public static TimeValue ofInstant(Instant instant) {
    return new TimeValue(Kind.INSTANT, Double.NaN, Objects.requireNonNull(instant, "instant"),
        null);
  }

  public static TimeValue ofText(String text) {
    return new TimeValue(Kind.TEXT, Double.NaN, null, Objects.requireNonNull(text, "text"));
  }

  /**
   * Interprets a raw cell. Numbers and numeric text become {@link Kind#NUMERIC}, recognised
   * timestamp text becomes {@link Kind#INSTANT}, everything else is kept as text.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static TimeValue of(Object raw) {
    if (raw == null) {
      throw new IllegalArgumentException("time value must not be null");
    }
    if (raw instanceof TimeValue value) {
      return value;
    }
    if (raw instanceof Number number) {
      return ofNumber(number.doubleValue());
    }
    if (raw instanceof Instant instant) {
      return ofInstant(instant);
    }
    if (raw instanceof OffsetDateTime dateTime) {
      return ofInstant(dateTime.toInstant());
    }
    if (raw instanceof LocalDateTime dateTime) {
      return ofInstant(dateTime.toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof LocalDate date) {
      return ofInstant(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    String trimmed = raw.toString().trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("time value must not be blank");
    }
    if (NUMBER.matcher(trimmed).matches()) {
      return ofNumber(Double.parseDouble(trimmed));
    }
    Instant parsed = parseTimestamp(trimmed);
    return parsed != null ? ofInstant(parsed) : ofText(trimmed);
  }

  private static Instant parseTimestamp(String candidate) {
    if (!LOOKS_LIKE_DATE.matcher(candidate).matches()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(candidate, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException ignored) {
      // not an offset date-time, try the zone-less forms
    }
    for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
      try {
        return LocalDateTime.parse(candidate, format).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    try {
      return LocalDate.parse(candidate, DateTimeFormatter.ISO_LOCAL_DATE)
          .atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNumeric() {
    return kind == Kind.NUMERIC;
  }

  public boolean isInstant() {
    return kind == Kind.INSTANT;
  }

  public Double axisValue() {
    return switch (kind) {
      case NUMERIC -> number;
      case INSTANT -> instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
      case TEXT -> null;
    };
  }

  public Instant instant() {
    return instant;
  }

  @JsonValue
  public Object serialized() {
    return switch (kind) {
      case NUMERIC -> number;
      case INSTANT -> instant.toString();
      case TEXT -> text;
    };
  }

  public String render() {
    return switch (kind) {
      case NUMERIC -> number == Math.rint(number) && Math.abs(number) < 1e15
          ? Long.toString((long) number)
          : Double.toString(number);
      case INSTANT -> instant.toString();
      case TEXT -> text;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeValue other)) {
      return false;
    }
    return kind == other.kind
        && Double.compare(number, other.number) == 0
        && Objects.equals(instant, other.instant)
        && Objects.equals(text, other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, number, instant, text);
  }

  @Override
  public String toString() {
    return render();
  }
}
