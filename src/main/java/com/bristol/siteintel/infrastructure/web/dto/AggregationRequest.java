package com.bristol.siteintel.infrastructure.web.dto;

import com.bristol.siteintel.domain.model.MetricRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record AggregationRequest(
        @NotEmpty
        @Size(max = 25)
        List<@Valid MetricRequestDto> requests
) {
    public List<MetricRequest> toRequests() {
        return requests.stream()
                .map(request -> new MetricRequest(request.upstreamId(), request.params()))
                .toList();
    }

    public record MetricRequestDto(
            @NotBlank String upstreamId,
            Map<String, String> params
    ) {}
}
