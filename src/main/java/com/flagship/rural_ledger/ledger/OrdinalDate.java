package com.flagship.rural_ledger.ledger;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Integer date key: {@code year * 10000 + month * 100 + day}.
 *
 * The key sorts and compares chronologically whatever text encoding the
 * date arrived in, so every range filter and ordering uses it.
 */
public final class OrdinalDate {

    private static final Pattern DAY_FIRST = Pattern.compile("^\\s*(\\d{1,2})/(\\d{1,2})/(\\d{4})\\s*$");
    private static final Pattern YEAR_FIRST = Pattern.compile("^\\s*(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})(?:[T ].*)?\\s*$");

    private OrdinalDate() {
    }

    public static int of(LocalDate date) {
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    public static LocalDate toLocalDate(int ordinal) {
        return LocalDate.of(ordinal / 10000, (ordinal / 100) % 100, ordinal % 100);
    }

    /**
     * Parses either legacy text encoding: {@code dd/MM/yyyy} or
     * {@code yyyy-MM-dd} (slashes accepted too, trailing time ignored).
     *
     * @return empty when the text matches neither pattern or is not a real date
     */
    public static Optional<LocalDate> parseLegacy(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = DAY_FIRST.matcher(text);
        if (m.matches()) {
            return build(m.group(3), m.group(2), m.group(1));
        }
        m = YEAR_FIRST.matcher(text);
        if (m.matches()) {
            return build(m.group(1), m.group(2), m.group(3));
        }
        return Optional.empty();
    }

    public static Optional<Integer> ordinalOf(String text) {
        return parseLegacy(text).map(OrdinalDate::of);
    }

    /**
     * Normalizes a legacy date to {@code dd/MM/yyyy}. Unparseable text is returned as is.
     */
    public static String toDisplay(String text) {
        return parseLegacy(text)
                .map(d -> String.format("%02d/%02d/%04d", d.getDayOfMonth(), d.getMonthValue(), d.getYear()))
                .orElse(text == null ? "" : text);
    }

    private static Optional<LocalDate> build(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
