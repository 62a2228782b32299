package com.bristol.siteintel.infrastructure.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyTest {

    @Test
    void shouldIgnoreParameterOrder() {
        // Given
        var first = new LinkedHashMap<String, String>();
        first.put("state", "37");
        first.put("county", "119");
        var second = new LinkedHashMap<String, String>();
        second.put("county", "119");
        second.put("state", "37");

        // When & Then
        assertThat(CacheKey.of("bls", first)).isEqualTo(CacheKey.of("bls", second));
        assertThat(CacheKey.of("bls", first).value()).isEqualTo("bls:county=119&state=37");
    }

    @Test
    void shouldNotCollideWhenValuesContainDelimiters() {
        var joined = CacheKey.of("x", Map.of("a", "1&b=2"));
        var separate = CacheKey.of("x", Map.of("a", "1", "b", "2"));

        assertThat(joined).isNotEqualTo(separate);
    }

    @Test
    void shouldNotCollideWhenKeyContainsEquals() {
        var inKey = CacheKey.of("x", Map.of("a=b", "c"));
        var inValue = CacheKey.of("x", Map.of("a", "b=c"));

        assertThat(inKey).isNotEqualTo(inValue);
    }

    @Test
    void shouldEscapePercentSoEscapesCannotBeForged() {
        var literal = CacheKey.of("x", Map.of("a", "%26"));
        var ampersand = CacheKey.of("x", Map.of("a", "&"));

        assertThat(literal).isNotEqualTo(ampersand);
    }

    @Test
    void shouldScopePrefixToOneUpstream() {
        var key = CacheKey.of("bls", Map.of("state", "37"));

        assertThat(key.startsWith(CacheKey.prefixFor("bls"))).isTrue();
        assertThat(CacheKey.of("blsx", Map.of()).startsWith(CacheKey.prefixFor("bls"))).isFalse();
    }
}
