package com.dmn.table;

import com.dmn.feel.value.ListValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a candidate value against a DMN unary test written in a decision table cell.
 * <p>
 * Supported forms:
 * <ul>
 *   <li>{@code -} or empty: matches anything</li>
 *   <li>{@code a, b, c}: matches if any part matches</li>
 *   <li>{@code not(a, b)}: matches if no part matches</li>
 *   <li>{@code < x}, {@code <= x}, {@code > x}, {@code >= x}, {@code == x}</li>
 *   <li>{@code [lo..hi]}, {@code (lo..hi)} and mixed brackets; a square bracket includes the bound</li>
 *   <li>a bare literal: number, boolean, ISO date, time, date-time, duration or string</li>
 * </ul>
 * Comparisons are type aware: both sides are tried as numbers, dates, times, date-times and
 * durations before falling back to string order. A list candidate matches if any element does;
 * a null candidate is never ordered against anything.
 */
public final class UnaryTestMatcher {

    private static final Pattern COMPARISON = Pattern.compile("^([<>]=?|==)\\s*(.+)$");
    private static final Pattern RANGE = Pattern.compile("^([\\[(])\\s*(.+?)\\s*\\.\\.\\s*(.+?)\\s*([\\])])$");
    private static final Pattern DURATION = Pattern.compile(
            "^(-)?P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?)?$");

    private UnaryTestMatcher() {
    }

    /**
     * Test a candidate value.
     *
     * @param test      Cell text
     * @param candidate Input value
     * @return true if the candidate satisfies the test
     */
    public static boolean matches(String test, Value candidate) {
        if (candidate.isNull()) {
            return matchesNull(test);
        }
        if (candidate instanceof ListValue list) {
            for (Value item : list.items()) {
                if (matches(test, item)) {
                    return true;
                }
            }
            return false;
        }
        return matches(test, candidate.asText());
    }

    /**
     * A null input satisfies only a wildcard, a {@code null} literal, or a negation that excludes no null.
     */
    static boolean matchesNull(String rawTest) {
        String test = rawTest == null ? "" : rawTest.trim();
        if (test.isEmpty() || "-".equals(test)) {
            return true;
        }
        if (test.startsWith("not(") && test.endsWith(")")) {
            return splitTopLevel(test.substring(4, test.length() - 1)).stream().noneMatch("null"::equals);
        }
        return splitTopLevel(test).stream().anyMatch("null"::equals);
    }

    /**
     * Test a candidate given in text form.
     */
    public static boolean matches(String rawTest, String candidate) {
        String test = rawTest == null ? "" : rawTest.trim();
        if (test.isEmpty() || "-".equals(test)) {
            return true;
        }
        if (test.startsWith("not(") && test.endsWith(")")) {
            for (String part : splitTopLevel(test.substring(4, test.length() - 1))) {
                if (matches(part, candidate)) {
                    return false;
                }
            }
            return true;
        }
        List<String> parts = splitTopLevel(test);
        if (parts.size() > 1) {
            for (String part : parts) {
                if (matches(part, candidate)) {
                    return true;
                }
            }
            return false;
        }
        if (matchesComparison(test, candidate) || matchesRange(test, candidate)) {
            return true;
        }
        return matchesLiteral(test, candidate.trim());
    }

    private static boolean matchesComparison(String test, String candidate) {
        Matcher m = COMPARISON.matcher(test);
        if (!m.matches()) {
            return false;
        }
        int cmp = compareValues(candidate.trim(), unquote(m.group(2).trim()));
        return switch (m.group(1)) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            case ">=" -> cmp >= 0;
            default -> cmp == 0;
        };
    }

    private static boolean matchesRange(String test, String candidate) {
        Matcher m = RANGE.matcher(test);
        if (!m.matches()) {
            return false;
        }
        boolean includeLow = "[".equals(m.group(1));
        boolean includeHigh = "]".equals(m.group(4));
        String value = candidate.trim();
        int low = compareValues(value, unquote(m.group(2)));
        int high = compareValues(value, unquote(m.group(3)));
        return (includeLow ? low >= 0 : low > 0) && (includeHigh ? high <= 0 : high < 0);
    }

    private static boolean matchesLiteral(String rawTest, String candidate) {
        String test = unquote(rawTest);

        Optional<Double> testNumber = Values.parseNumber(test);
        Optional<Double> candidateNumber = Values.parseNumber(candidate);
        if (testNumber.isPresent() && candidateNumber.isPresent()) {
            return testNumber.get().doubleValue() == candidateNumber.get().doubleValue();
        }

        Optional<Boolean> testBoolean = parseBoolean(test);
        Optional<Boolean> candidateBoolean = parseBoolean(candidate);
        if (testBoolean.isPresent() && candidateBoolean.isPresent()) {
            return testBoolean.get().equals(candidateBoolean.get());
        }

        for (Function<String, Optional<? extends Comparable<?>>> parser : temporalParsers()) {
            Optional<? extends Comparable<?>> parsedTest = parser.apply(test);
            if (parsedTest.isPresent()) {
                return parsedTest.equals(parser.apply(unquote(candidate)));
            }
        }
        return test.equals(unquote(candidate));
    }

    /**
     * Three-way comparison trying numbers, dates, times, date-times and durations in turn.
     */
    static int compareValues(String left, String right) {
        Optional<Double> a = Values.parseNumber(left);
        Optional<Double> b = Values.parseNumber(right);
        if (a.isPresent() && b.isPresent()) {
            return Double.compare(a.get() + 0.0, b.get() + 0.0);
        }
        return compareParsed(UnaryTestMatcher::parseDate, left, right)
                .or(() -> compareParsed(UnaryTestMatcher::parseTime, left, right))
                .or(() -> compareParsed(UnaryTestMatcher::parseDateTime, left, right))
                .or(() -> compareParsed(UnaryTestMatcher::parseDuration, left, right))
                .orElseGet(() -> Integer.signum(unquote(left).compareTo(unquote(right))));
    }

    private static <T extends Comparable<? super T>> Optional<Integer> compareParsed(
            Function<String, Optional<T>> parser, String left, String right) {
        Optional<T> a = parser.apply(unquote(left));
        Optional<T> b = parser.apply(unquote(right));
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Integer.signum(a.get().compareTo(b.get())));
    }

    private static List<Function<String, Optional<? extends Comparable<?>>>> temporalParsers() {
        return List.of(UnaryTestMatcher::parseDate, UnaryTestMatcher::parseTime,
                UnaryTestMatcher::parseDateTime, UnaryTestMatcher::parseDuration);
    }

    static Optional<LocalDate> parseDate(String text) {
        if (text.length() != 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalTime> parseTime(String text) {
        if (text.length() < 5 || text.charAt(2) != ':') {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalTime.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalDateTime> parseDateTime(String text) {
        if (text.indexOf('T') != 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * ISO 8601 duration, ordered by total months and then total seconds.
     */
    static Optional<DurationValue> parseDuration(String text) {
        Matcher m = DURATION.matcher(text);
        if (!m.matches() || "P".equals(text) || "-P".equals(text) || text.endsWith("T")) {
            return Optional.empty();
        }
        int sign = m.group(1) == null ? 1 : -1;
        long months = group(m, 2) * 12 + group(m, 3);
        double seconds = group(m, 4) * 86400.0 + group(m, 5) * 3600.0 + group(m, 6) * 60.0
                + (m.group(7) == null ? 0.0 : Double.parseDouble(m.group(7)));
        return Optional.of(new DurationValue(sign * months, sign * seconds));
    }

    private static long group(Matcher m, int index) {
        return m.group(index) == null ? 0 : Long.parseLong(m.group(index));
    }

    record DurationValue(long months, double seconds) implements Comparable<DurationValue> {
        @Override
        public int compareTo(DurationValue other) {
            if (months != other.months) {
                return Long.compare(months, other.months);
            }
            return Double.compare(seconds, other.seconds);
        }
    }

    private static Optional<Boolean> parseBoolean(String text) {
        return switch (text) {
            case "true", "True", "TRUE" -> Optional.of(true);
            case "false", "False", "FALSE" -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    static String unquote(String text) {
        String s = text.trim();
        if (s.length() >= 2
                && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    /**
     * Split on commas outside quotes, brackets and parentheses.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && (c == '(' || c == '[')) {
                depth++;
            } else if (!quoted && (c == ')' || c == ']')) {
                depth--;
            } else if (!quoted && depth == 0 && c == ',') {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
