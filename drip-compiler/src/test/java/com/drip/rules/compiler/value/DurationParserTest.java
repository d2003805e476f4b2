package com.drip.rules.compiler.value;

import com.drip.rules.api.exceptions.DurationParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationParserTest {

    @Test
    @DisplayName("Should parse days with a clock time")
    void shouldParseDaysWithClockTime() {
        assertThat(DurationParser.parse("3 days, 10:00:00"))
                .isEqualTo(Duration.ofDays(3).plusHours(10));
        assertThat(DurationParser.parse("1 day, 0:30:15"))
                .isEqualTo(Duration.ofDays(1).plusMinutes(30).plusSeconds(15));
    }

    @Test
    @DisplayName("Should parse a bare day count")
    void shouldParseBareDays() {
        assertThat(DurationParser.parse("3 days")).isEqualTo(Duration.ofDays(3));
        assertThat(DurationParser.parse("1 day")).isEqualTo(Duration.ofDays(1));
        assertThat(DurationParser.parse("-7 days")).isEqualTo(Duration.ofDays(-7));
    }

    @Test
    @DisplayName("Should treat the empty string as zero")
    void shouldParseEmptyAsZero() {
        assertThat(DurationParser.parse("")).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should drop leading plus signs")
    void shouldDropLeadingPlus() {
        assertThat(DurationParser.parse("+3 days")).isEqualTo(Duration.ofDays(3));
        assertThat(DurationParser.parse("+1:00:00")).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should parse clock times and bare seconds")
    void shouldParseClockTimes() {
        assertThat(DurationParser.parse("1:00:00")).isEqualTo(Duration.ofHours(1));
        assertThat(DurationParser.parse("15:30")).isEqualTo(Duration.ofMinutes(15).plusSeconds(30));
        assertThat(DurationParser.parse("30")).isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationParser.parse("0:00:01.5")).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("Should apply the time sign to the time part only")
    void shouldApplyTimeSignToTimePart() {
        assertThat(DurationParser.parse("-12:00:00")).isEqualTo(Duration.ofHours(-12));
        assertThat(DurationParser.parse("-1 day, 23:00:00")).isEqualTo(Duration.ofHours(-1));
        assertThat(DurationParser.parse("2 days, -1:00:00")).isEqualTo(Duration.ofDays(2).minusHours(1));
    }

    @Test
    @DisplayName("Should parse ISO 8601 durations")
    void shouldParseIso8601() {
        assertThat(DurationParser.parse("P3DT1H")).isEqualTo(Duration.ofDays(3).plusHours(1));
        assertThat(DurationParser.parse("-P1D")).isEqualTo(Duration.ofDays(-1));
        assertThat(DurationParser.parse("PT0,5S")).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("Should parse the interval form with a signed time")
    void shouldParseIntervalForm() {
        assertThat(DurationParser.parse("3 days 04:05:06"))
                .isEqualTo(Duration.ofDays(3).plusHours(4).plusMinutes(5).plusSeconds(6));
        assertThat(DurationParser.parse("3 days -04:00:00"))
                .isEqualTo(Duration.ofDays(3).minusHours(4));
    }

    @Test
    @DisplayName("Should reject malformed durations with the original input in the message")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> DurationParser.parse("abc"))
                .isInstanceOf(DurationParseException.class)
                .hasMessage("Could not parse duration: 'abc'");

        assertThatThrownBy(() -> DurationParser.parse("3 weeks"))
                .isInstanceOf(DurationParseException.class)
                .hasFieldOrPropertyWithValue("input", "3 weeks");
    }

    @Test
    @DisplayName("Should parse hour counts beyond the microsecond range of a long")
    void shouldParseLargeHourCounts() {
        assertThat(DurationParser.parse("9999999999:00:00")).isEqualTo(Duration.ofHours(9_999_999_999L));
        assertThat(DurationParser.parse("-9999999999:00:00")).isEqualTo(Duration.ofHours(-9_999_999_999L));
    }

    @Test
    @DisplayName("Should reject numbers too large for a duration")
    void shouldRejectOutOfRangeNumbers() {
        assertThatThrownBy(() -> DurationParser.parse("99999999999999999999 days"))
                .isInstanceOf(DurationParseException.class)
                .hasFieldOrPropertyWithValue("input", "99999999999999999999 days");
        assertThatThrownBy(() -> DurationParser.parse("999999999999999999:00:00"))
                .isInstanceOf(DurationParseException.class);
        assertThatThrownBy(() -> DurationParser.parse("P99999999999999999D"))
                .isInstanceOf(DurationParseException.class);
        assertThat(DurationParser.tryParse("99999999999999999999 days, 0")).isEmpty();
    }

    @Test
    @DisplayName("tryParse should not fall back to the ', 0' retry")
    void tryParseShouldNotRetry() {
        assertThat(DurationParser.tryParse("abc")).isEmpty();
        assertThat(DurationParser.tryParse("3 days, 0")).contains(Duration.ofDays(3));
    }

    @Test
    @DisplayName("Should format durations the way they are written in rules")
    void shouldFormatCanonically() {
        assertThat(DurationParser.format(Duration.ZERO)).isEqualTo("0:00:00");
        assertThat(DurationParser.format(Duration.ofDays(3).plusHours(4).plusMinutes(5).plusSeconds(6)))
                .isEqualTo("3 days, 4:05:06");
        assertThat(DurationParser.format(Duration.ofDays(1))).isEqualTo("1 day, 0:00:00");
        assertThat(DurationParser.format(Duration.ofHours(-1))).isEqualTo("-1 day, 23:00:00");
        assertThat(DurationParser.format(Duration.ofMillis(250))).isEqualTo("0:00:00.250000");
    }

    @Test
    @DisplayName("Formatted durations should parse back to the same value")
    void formattedDurationsShouldParseBack() {
        Duration[] samples = {
                Duration.ofDays(3).plusHours(10),
                Duration.ofHours(-1),
                Duration.ofDays(-7),
                Duration.ofSeconds(59, 123_456_000)
        };
        for (Duration sample : samples) {
            assertThat(DurationParser.parse(DurationParser.format(sample))).isEqualTo(sample);
        }
    }
}
