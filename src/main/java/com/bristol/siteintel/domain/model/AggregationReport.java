package com.bristol.siteintel.domain.model;

import java.util.List;

public record AggregationReport(List<SourceOutcome> outcomes) {

    public AggregationReport {
        outcomes = List.copyOf(outcomes);
    }

    public long succeeded() {
        return outcomes.stream().filter(SourceOutcome::isOk).count();
    }

    public long failed() {
        return outcomes.size() - succeeded();
    }
}
