package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.exception.InvalidMetricRequestException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.domain.port.out.UpstreamSource;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parameter validation shared by the upstream sources.
 */
public abstract class AbstractUpstreamSource implements UpstreamSource {

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");

    private final String upstreamId;
    private final UpstreamFamily family;

    protected AbstractUpstreamSource(String upstreamId, UpstreamFamily family) {
        this.upstreamId = upstreamId;
        this.family = family;
    }

    @Override
    public String upstreamId() {
        return upstreamId;
    }

    @Override
    public UpstreamFamily family() {
        return family;
    }

    protected MetricQuery query(Map<String, String> resolved) {
        return new MetricQuery(upstreamId, resolved);
    }

    protected String required(Map<String, String> params, String name) {
        var value = params.get(name);
        if (value == null || value.isBlank()) {
            throw invalid("Missing required parameter '" + name + "'");
        }
        return value.strip();
    }

    protected String optional(Map<String, String> params, String name, String defaultValue) {
        var value = params.get(name);
        return value == null || value.isBlank() ? defaultValue : value.strip();
    }

    /**
     * Left-pads a numeric code with zeros, e.g. state {@code 6 -> 06}.
     */
    protected String fipsCode(String value, String name, int width) {
        if (!DIGITS.matcher(value).matches() || value.length() > width) {
            throw invalid("Parameter '" + name + "' must be a numeric code of at most " + width + " digits");
        }
        return "0".repeat(width - value.length()) + value;
    }

    protected int year(String value, String name) {
        if (!YEAR.matcher(value).matches()) {
            throw invalid("Parameter '" + name + "' must be a four-digit year, got '" + value + "'");
        }
        return Integer.parseInt(value);
    }

    protected void requireOrdered(int from, int to, String fromName, String toName) {
        if (from > to) {
            throw invalid("Parameter '" + fromName + "' must not be after '" + toName + "'");
        }
    }

    protected int positiveInt(String value, String name, int max) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1 || parsed > max) {
                throw invalid("Parameter '" + name + "' must be between 1 and " + max);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid("Parameter '" + name + "' must be an integer, got '" + value + "'");
        }
    }

    protected double decimal(String value, String name, double min, double max) {
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || parsed < min || parsed > max) {
                throw invalid("Parameter '" + name + "' must be between " + min + " and " + max);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid("Parameter '" + name + "' must be numeric, got '" + value + "'");
        }
    }

    protected String oneOf(String value, String name, String... allowed) {
        for (var candidate : allowed) {
            if (candidate.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw invalid("Parameter '" + name + "' must be one of " + String.join(", ", allowed) + ", got '" + value + "'");
    }

    protected InvalidMetricRequestException invalid(String message) {
        return new InvalidMetricRequestException(upstreamId, message);
    }
}
