package com.bristol.siteintel.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeriesMetricsTest {

    @Test
    void shouldDeriveChangeAndGrowthForAnnualSeries() {
        // Given
        var points = List.of(
                new SeriesPoint("2022", 100.0),
                new SeriesPoint("2023", 110.0),
                new SeriesPoint("2024", 121.0));

        // When
        var derived = SeriesMetrics.derive(points);

        // Then
        assertThat(derived.latest()).isEqualTo(121.0);
        assertThat(derived.changeAbsolute()).isCloseTo(11.0, within(1e-9));
        assertThat(derived.changePercent()).isCloseTo(10.0, within(1e-9));
        assertThat(derived.cagr()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void shouldReturnAllNullWhenFewerThanTwoValuesPresent() {
        // Given
        var points = List.of(
                new SeriesPoint("2022", null),
                new SeriesPoint("2023", 110.0),
                new SeriesPoint("2024", null));

        // When
        var derived = SeriesMetrics.derive(points);

        // Then
        assertThat(derived).isEqualTo(DerivedMetrics.EMPTY);
    }

    @Test
    void shouldNullOnlyMetricsThatDependOnMissingPrior() {
        // Given
        var points = List.of(
                new SeriesPoint("2021", 100.0),
                new SeriesPoint("2022", 105.0),
                new SeriesPoint("2023", null),
                new SeriesPoint("2024", 121.0));

        // When
        var derived = SeriesMetrics.derive(points);

        // Then
        assertThat(derived.latest()).isEqualTo(121.0);
        assertThat(derived.changeAbsolute()).isNull();
        assertThat(derived.changePercent()).isNull();
        assertThat(derived.cagr()).isNotNull();
    }

    @Test
    void shouldNullEverythingButGrowthBaseWhenLatestMissing() {
        // Given
        var points = List.of(
                new SeriesPoint("2022", 100.0),
                new SeriesPoint("2023", 110.0),
                new SeriesPoint("2024", null));

        // When
        var derived = SeriesMetrics.derive(points);

        // Then
        assertThat(derived.latest()).isNull();
        assertThat(derived.changeAbsolute()).isNull();
        assertThat(derived.changePercent()).isNull();
        assertThat(derived.cagr()).isNull();
    }

    @Test
    void shouldTreatZeroAsDataButNotDivideByIt() {
        // Given
        var points = List.of(
                new SeriesPoint("2023", 0.0),
                new SeriesPoint("2024", 5.0));

        // When
        var derived = SeriesMetrics.derive(points);

        // Then
        assertThat(derived.latest()).isEqualTo(5.0);
        assertThat(derived.changeAbsolute()).isEqualTo(5.0);
        assertThat(derived.changePercent()).isNull();
        assertThat(derived.cagr()).isNull();
    }

    @Test
    void shouldUseFractionalYearsForMonthlyGrowth() {
        // Given
        var points = List.of(
                new SeriesPoint("2022-01", 100.0),
                new SeriesPoint("2022-07", 102.0),
                new SeriesPoint("2023-07", 121.0));

        // When
        var derived = SeriesMetrics.derive(points);

        // Then
        double expected = (Math.pow(1.21, 1 / 1.5) - 1) * 100;
        assertThat(derived.cagr()).isCloseTo(expected, within(1e-9));
    }

    @Test
    void shouldReadQuarterlyKeysAsFractionalYears() {
        assertThat(PeriodKeys.toFractionalYear("2024-Q3")).isEqualTo(2024.5);
        assertThat(PeriodKeys.toFractionalYear("2024-04")).isEqualTo(2024.25);
        assertThat(PeriodKeys.toFractionalYear("2024")).isEqualTo(2024.0);
    }
}
