package com.drip.rules.compiler.value;

import com.drip.rules.api.exceptions.DurationParseException;
import com.drip.rules.api.value.BooleanValue;
import com.drip.rules.api.value.DateTimeValue;
import com.drip.rules.api.value.DateValue;
import com.drip.rules.api.value.FieldReference;
import com.drip.rules.api.value.ScalarValue;
import com.drip.rules.api.value.TypedValue;
import com.drip.rules.compiler.config.DripConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueParserTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ValueParser parser;
    private Clock clock;

    @BeforeEach
    void setUp() {
        parser = new ValueParser(DripConfig.defaults());
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Nested
    @DisplayName("now")
    class RelativeDateTime {

        @Test
        @DisplayName("Bare now should be the clock instant")
        void bareNowIsClockInstant() {
            assertThat(parser.parse("now", clock)).isEqualTo(new DateTimeValue(NOW));
        }

        @Test
        @DisplayName("now with a duration should shift the clock instant")
        void nowWithDurationShifts() {
            assertThat(parser.parse("now-1 day, 0:00:00", clock))
                    .isEqualTo(new DateTimeValue(NOW.minus(Duration.ofDays(1))));
            assertThat(parser.parse("now+3 days", clock))
                    .isEqualTo(new DateTimeValue(NOW.plus(Duration.ofDays(3))));
            assertThat(parser.parse("now-12:00:00", clock))
                    .isEqualTo(new DateTimeValue(NOW.minus(Duration.ofHours(12))));
        }

        @Test
        @DisplayName("now with garbage should raise a duration error")
        void nowWithGarbageFails() {
            assertThatThrownBy(() -> parser.parse("nowhere", clock))
                    .isInstanceOf(DurationParseException.class)
                    .hasMessageContaining("here");
        }

        @Test
        @DisplayName("now shifted past the supported instant range should raise a duration error")
        void nowOutOfRangeFails() {
            assertThatThrownBy(() -> parser.parse("now+999999999999 days", clock))
                    .isInstanceOf(DurationParseException.class)
                    .hasFieldOrPropertyWithValue("input", "+999999999999 days")
                    .hasCauseInstanceOf(DateTimeException.class);
        }
    }

    @Nested
    @DisplayName("today")
    class RelativeDate {

        @Test
        @DisplayName("Bare today should be the clock's date")
        void bareTodayIsClockDate() {
            assertThat(parser.parse("today", clock)).isEqualTo(new DateValue(LocalDate.of(2024, 1, 1)));
        }

        @Test
        @DisplayName("today+3 days should be three days later")
        void todayPlusDays() {
            assertThat(parser.parse("today+3 days", clock)).isEqualTo(new DateValue(LocalDate.of(2024, 1, 4)));
        }

        @Test
        @DisplayName("Partial days should round towards the past")
        void partialDaysRoundDown() {
            assertThat(parser.parse("today-12:00:00", clock)).isEqualTo(new DateValue(LocalDate.of(2023, 12, 31)));
            assertThat(parser.parse("today+12:00:00", clock)).isEqualTo(new DateValue(LocalDate.of(2024, 1, 1)));
        }

        @Test
        @DisplayName("today should use the clock's zone")
        void todayUsesClockZone() {
            Clock tokyo = Clock.fixed(Instant.parse("2024-01-01T20:00:00Z"), ZoneId.of("Asia/Tokyo"));
            assertThat(parser.parse("today", tokyo)).isEqualTo(new DateValue(LocalDate.of(2024, 1, 2)));
        }

        @Test
        @DisplayName("today shifted past the supported date range should raise a duration error")
        void todayOutOfRangeFails() {
            assertThatThrownBy(() -> parser.parse("today-999999999999 days", clock))
                    .isInstanceOf(DurationParseException.class)
                    .hasCauseInstanceOf(DateTimeException.class);
        }
    }

    @Test
    @DisplayName("F_ prefix should produce a field reference")
    void fieldReference() {
        TypedValue value = parser.parse("F_referrer_id", clock);

        assertThat(value).isEqualTo(new FieldReference("referrer_id"));
        assertThat(value.isDeferred()).isTrue();
    }

    @Test
    @DisplayName("Field reference prefix should follow configuration")
    void configuredFieldReferencePrefix() {
        ValueParser custom = new ValueParser(DripConfig.defaults().toBuilder().fieldReferencePrefix("$").build());

        assertThat(custom.parse("$last_login", clock)).isEqualTo(new FieldReference("last_login"));
        assertThat(custom.parse("F_last_login", clock)).isEqualTo(new ScalarValue("F_last_login"));
    }

    @Test
    @DisplayName("Exactly True and False should become booleans")
    void booleans() {
        assertThat(parser.parse("True", clock)).isEqualTo(BooleanValue.TRUE);
        assertThat(parser.parse("False", clock)).isEqualTo(BooleanValue.FALSE);
        assertThat(parser.parse("true", clock)).isEqualTo(new ScalarValue("true"));
        assertThat(parser.parse("TRUE", clock)).isEqualTo(new ScalarValue("TRUE"));
    }

    @Test
    @DisplayName("Anything else should pass through unchanged")
    void scalarPassthrough() {
        assertThat(parser.parse("18", clock)).isEqualTo(new ScalarValue("18"));
        assertThat(parser.parse("", clock)).isEqualTo(new ScalarValue(""));
        assertThat(parser.parse("  spaced  ", clock)).isEqualTo(new ScalarValue("  spaced  "));
        assertThat(parser.parse("yesterday", clock)).isEqualTo(new ScalarValue("yesterday"));
    }

    @Test
    @DisplayName("Syntaxes should be tried in priority order")
    void priorityOrder() {
        assertThat(parser.syntaxOf("now")).isEqualTo(ValueSyntax.RELATIVE_DATETIME);
        assertThat(parser.syntaxOf("today")).isEqualTo(ValueSyntax.RELATIVE_DATE);
        assertThat(parser.syntaxOf("F_now")).isEqualTo(ValueSyntax.FIELD_REFERENCE);
        assertThat(parser.syntaxOf("True")).isEqualTo(ValueSyntax.BOOLEAN);
        assertThat(parser.syntaxOf("Now")).isEqualTo(ValueSyntax.SCALAR);
    }

    @Test
    @DisplayName("Parsing should be deterministic for a fixed clock")
    void deterministic() {
        assertThat(parser.parse("now-7 days", clock)).isEqualTo(parser.parse("now-7 days", clock));
    }
}
