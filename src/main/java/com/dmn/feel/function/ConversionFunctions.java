package com.dmn.feel.function;

import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.dmn.feel.function.FormalParameter.optional;
import static com.dmn.feel.function.FormalParameter.required;
import static com.dmn.feel.function.FunctionSupport.arg;
import static com.dmn.feel.function.FunctionSupport.integer;
import static com.dmn.feel.function.FunctionSupport.string;

/**
 * Conversion functions.
 * <p>
 * Temporal values stay ISO-8601 strings: {@code date}, {@code time}, {@code date and time}
 * and {@code duration} validate their input and return it in ISO form.
 */
final class ConversionFunctions {

    private static final Pattern DATE_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");

    private ConversionFunctions() {
    }

    static void register(FunctionLibrary.Builder library) {
        library.define(FunctionSignature.variadic("date", required("from")), ConversionFunctions::date);
        library.define(FunctionSignature.of("time", required("from")), ConversionFunctions::time);
        library.define(FunctionSignature.of("date and time", required("from")), ConversionFunctions::dateAndTime);
        library.define(FunctionSignature.of("duration", required("from")), ConversionFunctions::duration);
        library.define(FunctionSignature.of("years and months duration", required("from"), required("to")),
                ConversionFunctions::yearsAndMonths);

        library.define(FunctionSignature.of("day of year", required("date")),
                onDate(d -> Value.of(d.getDayOfYear())));
        library.define(FunctionSignature.of("day of week", required("date")),
                onDate(d -> Value.of(d.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))));
        library.define(FunctionSignature.of("month of year", required("date")),
                onDate(d -> Value.of(d.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH))));
        library.define(FunctionSignature.of("week of year", required("date")),
                onDate(d -> Value.of(d.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))));

        library.define(FunctionSignature.of("string", required("from")), ConversionFunctions::toText);
        library.define(FunctionSignature.of("number",
                        required("from"), optional("grouping separator"), optional("decimal separator")),
                ConversionFunctions::number);

        library.define(FunctionSignature.of("today"), args -> Value.of(LocalDate.now().toString()));
        library.define(FunctionSignature.of("now"), args -> Value.of(OffsetDateTime.now().withNano(0).toString()));
    }

    /**
     * {@code date("2017-01-31")}, {@code date("2017-01-31T10:00:00")} (date part) or {@code date(2017, 1, 31)}.
     */
    static Value date(List<Value> args) {
        if (args.size() == 1) {
            return string(args, 0)
                    .flatMap(ConversionFunctions::parseDate)
                    .map(d -> Value.of(d.toString()))
                    .orElse(Value.NULL);
        }
        if (args.size() == 3) {
            Optional<Integer> year = integer(args, 0);
            Optional<Integer> month = integer(args, 1);
            Optional<Integer> day = integer(args, 2);
            if (year.isEmpty() || month.isEmpty() || day.isEmpty()) {
                return Value.NULL;
            }
            try {
                return Value.of(LocalDate.of(year.get(), month.get(), day.get()).toString());
            } catch (DateTimeException e) {
                return Value.NULL;
            }
        }
        return Value.NULL;
    }

    static Value time(List<Value> args) {
        Optional<String> text = string(args, 0);
        if (text.isEmpty()) {
            return Value.NULL;
        }
        String s = text.get();
        if (tryParse(s, LocalTime::parse) || tryParse(s, OffsetTime::parse)) {
            return Value.of(s);
        }
        return Value.NULL;
    }

    /**
     * A bare date is promoted to midnight.
     */
    static Value dateAndTime(List<Value> args) {
        Optional<String> text = string(args, 0);
        if (text.isEmpty()) {
            return Value.NULL;
        }
        String s = text.get();
        if (tryParse(s, LocalDateTime::parse) || tryParse(s, OffsetDateTime::parse)) {
            return Value.of(s);
        }
        if (tryParse(s, LocalDate::parse)) {
            return Value.of(s + "T00:00:00");
        }
        return Value.NULL;
    }

    static Value duration(List<Value> args) {
        Optional<String> text = string(args, 0);
        if (text.isEmpty()) {
            return Value.NULL;
        }
        String s = text.get();
        if (tryParse(s, Duration::parse) || tryParse(s, Period::parse)) {
            return Value.of(s);
        }
        return Value.NULL;
    }

    static Value yearsAndMonths(List<Value> args) {
        Optional<LocalDate> from = string(args, 0).flatMap(ConversionFunctions::parseDate);
        Optional<LocalDate> to = string(args, 1).flatMap(ConversionFunctions::parseDate);
        if (from.isEmpty() || to.isEmpty()) {
            return Value.NULL;
        }
        Period period = Period.between(from.get(), to.get()).withDays(0).normalized();
        return Value.of(period.isZero() ? "P0M" : period.toString());
    }

    static Value toText(List<Value> args) {
        Value from = arg(args, 0);
        if (from.isNull()) {
            return Value.NULL;
        }
        return from instanceof StringValue ? from : Value.of(from.asText());
    }

    /**
     * Parse text with optional grouping and decimal separators; unparseable text yields null.
     */
    static Value number(List<Value> args) {
        Optional<String> text = string(args, 0);
        if (text.isEmpty()) {
            return Value.NULL;
        }
        Value grouping = arg(args, 1);
        Value decimal = arg(args, 2);
        if ((!grouping.isNull() && !(grouping instanceof StringValue))
                || (!decimal.isNull() && !(decimal instanceof StringValue))) {
            return Value.NULL;
        }

        String s = text.get();
        if (grouping instanceof StringValue g && !g.value().isEmpty()) {
            s = s.replace(g.value(), "");
        }
        if (decimal instanceof StringValue d && !d.value().isEmpty()) {
            s = s.replace(d.value(), ".");
        }
        return Values.parseNumber(s).map(Value::of).orElse(Value.NULL);
    }

    private static FeelFunction onDate(Function<LocalDate, Value> body) {
        return args -> string(args, 0)
                .flatMap(ConversionFunctions::parseDate)
                .map(body)
                .orElse(Value.NULL);
    }

    static Optional<LocalDate> parseDate(String text) {
        Matcher matcher = DATE_PREFIX.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group(1)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static boolean tryParse(String text, Function<String, ?> parser) {
        try {
            parser.apply(text);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }
}
