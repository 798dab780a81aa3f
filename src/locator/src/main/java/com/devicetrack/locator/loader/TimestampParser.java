package com.devicetrack.locator.loader;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Parses the date strings found in telemetry exports and query parameters into instants.
 *
 * <p>Accepted forms: {@code 2021-10-23T14:08:00.123456Z}, {@code 2021-10-23 14:08:00+05:30},
 * {@code 2021-10-23 14:08:00+00},
 * {@code 2021-10-23T14:08:00} and {@code 2021-10-23}. Values without an offset are read as UTC.
 */
public final class TimestampParser {
  private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .appendValue(ChronoField.HOUR_OF_DAY, 2)
      .appendLiteral(':')
      .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
      .optionalStart()
      .appendLiteral(':')
      .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .optionalEnd()
      // Lenient offset: +HH, +HHmm, +HH:mm and +HH:mm:ss all parse.
      .optionalStart().parseLenient().appendOffset("+HH", "Z").parseStrict().optionalEnd()
      .toFormatter();

  private TimestampParser() {}

  /**
   * Parses a timestamp string.
   *
   * @param raw raw value
   * @return parsed instant, or empty when the value is blank or not a recognized timestamp
   */
  public static Optional<Instant> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    try {
      TemporalAccessor parsed = DATE_TIME.parse(value);
      ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS)
          ? ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS))
          : ZoneOffset.UTC;
      OffsetDateTime dateTime = LocalDateTime.from(parsed).atOffset(offset);
      return Optional.of(dateTime.toInstant());
    } catch (DateTimeException ex) {
      return parseDate(value);
    }
  }

  private static Optional<Instant> parseDate(String value) {
    try {
      return Optional.of(LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
