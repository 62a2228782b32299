package com.bristol.siteintel.domain.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Period keys are {@code YYYY}, {@code YYYY-MM} or {@code YYYY-Qn}; all three sort correctly as strings.
 */
public final class PeriodKeys {

    private static final Pattern ANNUAL = Pattern.compile("^(\\d{4})$");
    private static final Pattern MONTHLY = Pattern.compile("^(\\d{4})-(0[1-9]|1[0-2])$");
    private static final Pattern QUARTERLY = Pattern.compile("^(\\d{4})-Q([1-4])$");

    private PeriodKeys() {
    }

    public static String annual(int year) {
        return String.format("%04d", year);
    }

    public static String monthly(int year, int month) {
        return String.format("%04d-%02d", year, month);
    }

    public static String quarterly(int year, int quarter) {
        return String.format("%04d-Q%d", year, quarter);
    }

    public static boolean isValid(String periodKey) {
        return periodKey != null && (ANNUAL.matcher(periodKey).matches()
                || MONTHLY.matcher(periodKey).matches()
                || QUARTERLY.matcher(periodKey).matches());
    }

    /**
     * Start of the period in fractional years, e.g. {@code 2024-04 -> 2024.25}.
     */
    public static double toFractionalYear(String periodKey) {
        Matcher annual = ANNUAL.matcher(periodKey);
        if (annual.matches()) {
            return Integer.parseInt(annual.group(1));
        }
        Matcher monthly = MONTHLY.matcher(periodKey);
        if (monthly.matches()) {
            return Integer.parseInt(monthly.group(1)) + (Integer.parseInt(monthly.group(2)) - 1) / 12.0;
        }
        Matcher quarterly = QUARTERLY.matcher(periodKey);
        if (quarterly.matches()) {
            return Integer.parseInt(quarterly.group(1)) + (Integer.parseInt(quarterly.group(2)) - 1) / 4.0;
        }
        throw new IllegalArgumentException("Unsupported period key: " + periodKey);
    }
}
