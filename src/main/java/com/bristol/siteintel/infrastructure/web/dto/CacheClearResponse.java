package com.bristol.siteintel.infrastructure.web.dto;

public record CacheClearResponse(
        String prefix,
        int removed
) {}
