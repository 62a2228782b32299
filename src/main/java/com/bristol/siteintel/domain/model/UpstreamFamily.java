package com.bristol.siteintel.domain.model;

public enum UpstreamFamily {
    LABOR,
    CRIME,
    ECONOMIC,
    CLIMATE,
    PLACES,
    DEMOGRAPHICS,
    HOUSING
}
