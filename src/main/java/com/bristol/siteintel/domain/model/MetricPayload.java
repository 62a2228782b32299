package com.bristol.siteintel.domain.model;

/**
 * Normalized data returned for one upstream query, either a time series or an amenity profile.
 */
public interface MetricPayload {
}
