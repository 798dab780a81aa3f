package com.devicetrack.locator.loader;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimestampParserTest {

  @Test
  void parsesIsoInstantWithMicroseconds() {
    assertThat(TimestampParser.parse("2021-10-23T14:08:00.123456Z"))
        .hasValue(Instant.parse("2021-10-23T14:08:00.123456Z"));
  }

  @Test
  void parsesSpaceSeparatedDateTimeWithOffset() {
    assertThat(TimestampParser.parse("2021-10-23 19:38:00+05:30"))
        .hasValue(Instant.parse("2021-10-23T14:08:00Z"));
  }

  @Test
  void parsesCompactOffset() {
    assertThat(TimestampParser.parse("2021-10-23T16:08:00.5+0200"))
        .hasValue(Instant.parse("2021-10-23T14:08:00.500Z"));
  }

  @Test
  void parsesHourOnlyOffset() {
    assertThat(TimestampParser.parse("2021-10-23 14:08:00+00"))
        .hasValue(Instant.parse("2021-10-23T14:08:00Z"));
    assertThat(TimestampParser.parse("2021-10-23T14:08:00.123+05"))
        .hasValue(Instant.parse("2021-10-23T09:08:00.123Z"));
    assertThat(TimestampParser.parse("2021-10-23T07:08:00-07"))
        .hasValue(Instant.parse("2021-10-23T14:08:00Z"));
  }

  @Test
  void parsesOffsetWithSeconds() {
    assertThat(TimestampParser.parse("2021-10-23T19:38:10+05:30:10"))
        .hasValue(Instant.parse("2021-10-23T14:08:00Z"));
  }

  @Test
  void treatsZonelessValuesAsUtc() {
    assertThat(TimestampParser.parse("2021-10-23 14:08:00.000000001"))
        .hasValue(Instant.parse("2021-10-23T14:08:00.000000001Z"));
    assertThat(TimestampParser.parse("2021-10-23T14:08"))
        .hasValue(Instant.parse("2021-10-23T14:08:00Z"));
  }

  @Test
  void parsesPlainDateAsStartOfDay() {
    assertThat(TimestampParser.parse("2021-10-23")).hasValue(Instant.parse("2021-10-23T00:00:00Z"));
  }

  @Test
  void rejectsGarbageAndBlankValues() {
    assertThat(TimestampParser.parse("yesterday")).isEmpty();
    assertThat(TimestampParser.parse("2021-13-45T10:00:00Z")).isEmpty();
    assertThat(TimestampParser.parse("  ")).isEmpty();
    assertThat(TimestampParser.parse(null)).isEmpty();
  }
}
