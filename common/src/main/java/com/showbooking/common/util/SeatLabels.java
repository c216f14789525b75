package com.showbooking.common.util;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seat labels are a row of letters followed by a seat number: {@code A1}, {@code B12},
 * {@code AA3}. Rows run A..Z, then AA, AB, ... in the same way spreadsheet columns do.
 */
public final class SeatLabels {

    private static final Pattern LABEL_PATTERN = Pattern.compile("^([A-Z]+)([1-9][0-9]*)$");

    /**
     * Natural label order: shorter rows first, then row letters, then seat number,
     * so A2 sorts before A10 and Z9 before AA1.
     */
    public static final Comparator<String> NATURAL_ORDER =
        Comparator.comparing(SeatLabels::parse, Comparator
            .comparingInt((Parsed p) -> p.row().length())
            .thenComparing(Parsed::row)
            .thenComparingInt(Parsed::number));

    private SeatLabels() {
    }

    public record Parsed(String row, int number) {
    }

    public static String label(String row, int number) {
        return row + number;
    }

    /**
     * @throws IllegalArgumentException if the label is not a row followed by a positive number
     */
    public static Parsed parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Seat label is required");
        }
        Matcher matcher = LABEL_PATTERN.matcher(label.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid seat label: " + label);
        }
        return new Parsed(matcher.group(1), Integer.parseInt(matcher.group(2)));
    }

    public static String normalize(String label) {
        Parsed parsed = parse(label);
        return label(parsed.row(), parsed.number());
    }

    /**
     * Row name for a zero-based row index: 0 -> A, 25 -> Z, 26 -> AA.
     */
    public static String rowName(int rowIndex) {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("Row index must not be negative: " + rowIndex);
        }
        StringBuilder sb = new StringBuilder();
        int n = rowIndex + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }
}
