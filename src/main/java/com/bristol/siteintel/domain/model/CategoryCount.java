package com.bristol.siteintel.domain.model;

public record CategoryCount(String id, String name, int count, double weight) {

    public double weightedScore() {
        return count * weight;
    }
}
