package com.bristol.siteintel.application;

import com.bristol.siteintel.domain.exception.UnknownUpstreamException;
import com.bristol.siteintel.domain.port.out.UpstreamSource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class UpstreamSources {

    private final Map<String, UpstreamSource> sources = new TreeMap<>();

    public UpstreamSources(List<UpstreamSource> sources) {
        for (var source : sources) {
            if (this.sources.put(source.upstreamId(), source) != null) {
                throw new IllegalStateException("Duplicate upstream id " + source.upstreamId());
            }
        }
    }

    public UpstreamSource require(String upstreamId) {
        var source = upstreamId == null ? null : sources.get(upstreamId);
        if (source == null) {
            throw new UnknownUpstreamException(upstreamId);
        }
        return source;
    }
}
