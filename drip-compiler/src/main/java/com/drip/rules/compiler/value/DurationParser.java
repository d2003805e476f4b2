/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler.value;

import com.drip.rules.api.exceptions.DurationParseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the signed durations used after {@code now} and {@code today}.
 *
 * <p>Accepted forms, tried in order:
 * <ol>
 *   <li>Standard: {@code [D day[s], ][-][[H:]M:]S[.ffffff]}, e.g. {@code 3 days, 10:00:00}</li>
 *   <li>ISO 8601: {@code [-+]P[nD][T[nH][nM][nS]]}, e.g. {@code -P3DT1H}</li>
 *   <li>Interval: {@code [D day[s] ][[-+]HH:MM:SS[.ffffff]]}, e.g. {@code -7 days}</li>
 * </ol>
 * Leading {@code +} signs are dropped first. When nothing matches and the input has no
 * comma, the input is retried as {@code "<input>, 0"} so a bare day count reads as
 * "N days, 0 seconds".
 *
 * <p>In the standard and interval forms the day count carries its own sign and the
 * time part's sign applies to the time part only: {@code -1 day, 23:00:00} is one hour
 * back. Precision is one microsecond.
 */
public final class DurationParser {

    private static final Pattern STANDARD = Pattern.compile(
            "^(?:(?<days>-?\\d+) (days?, )?)?"
                    + "(?<sign>-?)"
                    + "((?:(?<hours>\\d+):)(?=\\d+:\\d+))?"
                    + "(?:(?<minutes>\\d+):)?"
                    + "(?<seconds>\\d+)"
                    + "(?:[.,](?<microseconds>\\d{1,6})\\d{0,6})?$");

    private static final Pattern ISO_8601 = Pattern.compile(
            "^(?<sign>[-+]?)P"
                    + "(?:(?<days>\\d+([.,]\\d+)?)D)?"
                    + "(?:T"
                    + "(?:(?<hours>\\d+([.,]\\d+)?)H)?"
                    + "(?:(?<minutes>\\d+([.,]\\d+)?)M)?"
                    + "(?:(?<seconds>\\d+([.,]\\d+)?)S)?"
                    + ")?$");

    private static final Pattern INTERVAL = Pattern.compile(
            "^(?:(?<days>-?\\d+) (days? ?))?"
                    + "(?:(?<sign>[-+])?"
                    + "(?<hours>\\d+):"
                    + "(?<minutes>\\d\\d):"
                    + "(?<seconds>\\d\\d)"
                    + "(?:\\.(?<microseconds>\\d{1,6}))?"
                    + ")?$");

    private static final long SECONDS_PER_DAY = 86_400L;
    private static final BigDecimal MICROS_PER_SECOND = BigDecimal.valueOf(1_000_000L);

    private DurationParser() {
    }

    /**
     * Parses a signed duration.
     *
     * @param value the text after the {@code now}/{@code today} prefix; may be empty
     * @return the parsed duration; {@link Duration#ZERO} for an empty input
     * @throws DurationParseException if neither the input nor its {@code ", 0"} retry parses
     */
    public static Duration parse(String value) {
        if (value == null) {
            throw new DurationParseException("null");
        }
        String stripped = stripLeadingPlus(value);
        Optional<Duration> duration = tryParse(stripped);
        if (duration.isEmpty() && !stripped.contains(",")) {
            duration = tryParse(stripped + ", 0");
        }
        return duration.orElseThrow(() -> new DurationParseException(value));
    }

    /**
     * Parses a duration in one of the three forms, without the {@code ", 0"} retry.
     * Input that matches a form but does not fit a {@link Duration} is not a match.
     */
    public static Optional<Duration> tryParse(String value) {
        try {
            Matcher standard = STANDARD.matcher(value);
            if (standard.matches()) {
                return Optional.of(fromClockParts(standard));
            }
            Matcher iso = ISO_8601.matcher(value);
            if (iso.matches()) {
                return Optional.of(fromIsoParts(iso));
            }
            Matcher interval = INTERVAL.matcher(value);
            if (interval.matches()) {
                return Optional.of(fromClockParts(interval));
            }
        } catch (NumberFormatException | ArithmeticException e) {
            // out of range for a Duration
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Renders the canonical form, e.g. {@code 3 days, 4:05:06} or {@code -1 day, 23:00:00.250000}.
     * Parsing the result yields an equal duration (at microsecond precision).
     */
    public static String format(Duration duration) {
        long seconds = duration.getSeconds();
        long days = Math.floorDiv(seconds, SECONDS_PER_DAY);
        long secondsOfDay = Math.floorMod(seconds, SECONDS_PER_DAY);
        long micros = duration.getNano() / 1_000L;

        StringBuilder sb = new StringBuilder();
        if (days != 0) {
            sb.append(days).append(Math.abs(days) == 1 ? " day, " : " days, ");
        }
        sb.append(String.format("%d:%02d:%02d",
                secondsOfDay / 3600, (secondsOfDay % 3600) / 60, secondsOfDay % 60));
        if (micros != 0) {
            sb.append(String.format(".%06d", micros));
        }
        return sb.toString();
    }

    private static String stripLeadingPlus(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '+') {
            start++;
        }
        return value.substring(start);
    }

    private static Duration fromClockParts(Matcher m) {
        Duration days = Duration.ofDays(parseLong(m.group("days")));

        Duration time = Duration.ofHours(parseLong(m.group("hours")))
                .plusMinutes(parseLong(m.group("minutes")))
                .plusSeconds(parseLong(m.group("seconds")))
                .plus(parseMicros(m.group("microseconds")), ChronoUnit.MICROS);

        return "-".equals(m.group("sign")) ? days.minus(time) : days.plus(time);
    }

    private static Duration fromIsoParts(Matcher m) {
        BigDecimal totalSeconds = decimal(m.group("days")).multiply(BigDecimal.valueOf(SECONDS_PER_DAY))
                .add(decimal(m.group("hours")).multiply(BigDecimal.valueOf(3600)))
                .add(decimal(m.group("minutes")).multiply(BigDecimal.valueOf(60)))
                .add(decimal(m.group("seconds")));
        long micros = totalSeconds.multiply(MICROS_PER_SECOND)
                .setScale(0, RoundingMode.HALF_EVEN)
                .longValueExact();
        Duration duration = Duration.of(micros, ChronoUnit.MICROS);
        return "-".equals(m.group("sign")) ? duration.negated() : duration;
    }

    private static long parseLong(String group) {
        return group == null || group.isEmpty() ? 0L : Long.parseLong(group);
    }

    private static long parseMicros(String group) {
        if (group == null || group.isEmpty()) return 0L;
        StringBuilder padded = new StringBuilder(group);
        while (padded.length() < 6) {
            padded.append('0');
        }
        return Long.parseLong(padded.toString());
    }

    private static BigDecimal decimal(String group) {
        return group == null ? BigDecimal.ZERO : new BigDecimal(group.replace(',', '.'));
    }
}
