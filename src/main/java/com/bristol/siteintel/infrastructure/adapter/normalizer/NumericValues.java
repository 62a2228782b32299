package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;

/**
 * Lenient numeric coercion for statistical payloads. Suppression markers and anything that
 * does not parse become null, never zero.
 */
public final class NumericValues {

    private static final Set<String> NOT_AVAILABLE = Set.of("(NA)", "(D)", "(X)", "(S)", "(L)", "N/A", "NA", "-", "--");

    private NumericValues() {
    }

    public static Double parse(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return finite(node.doubleValue());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        return null;
    }

    public static Double parse(String raw) {
        if (raw == null) {
            return null;
        }
        var trimmed = raw.strip();
        if (trimmed.isEmpty() || NOT_AVAILABLE.contains(trimmed.toUpperCase(Locale.ROOT))) {
            return null;
        }
        var cleaned = trimmed.replace(",", "");
        try {
            return finite(Double.parseDouble(cleaned));
        } catch (NumberFormatException e) {
            // Unparseable values are treated as missing data
            return null;
        }
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
