package com.bristol.siteintel.domain.model;

public record PlaceSummary(String name, String categoryId, String category, Integer distanceMeters) {
}
