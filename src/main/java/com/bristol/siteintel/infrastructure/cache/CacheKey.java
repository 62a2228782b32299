package com.bristol.siteintel.infrastructure.cache;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Deterministic key of the form {@code upstream:k1=v1&k2=v2} with parameters sorted by name.
 * Delimiters inside names and values are percent-escaped so distinct parameter maps never collide.
 */
public record CacheKey(String value) {

    public CacheKey {
        Objects.requireNonNull(value, "value");
    }

    public static CacheKey of(String upstreamId, Map<String, String> params) {
        var builder = new StringBuilder(escape(upstreamId)).append(':');
        var sorted = new TreeMap<>(params);
        var first = true;
        for (var param : sorted.entrySet()) {
            if (!first) {
                builder.append('&');
            }
            builder.append(escape(param.getKey()))
                    .append('=')
                    .append(escape(Objects.requireNonNull(param.getValue(), param.getKey())));
            first = false;
        }
        return new CacheKey(builder.toString());
    }

    /**
     * Prefix that matches every key of one upstream.
     */
    public static String prefixFor(String upstreamId) {
        return escape(upstreamId) + ':';
    }

    public boolean startsWith(String prefix) {
        return value.startsWith(prefix);
    }

    static String escape(String raw) {
        var escaped = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            switch (c) {
                case '%' -> escaped.append("%25");
                case ':' -> escaped.append("%3A");
                case '=' -> escaped.append("%3D");
                case '&' -> escaped.append("%26");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    @Override
    public String toString() {
        return value;
    }
}
