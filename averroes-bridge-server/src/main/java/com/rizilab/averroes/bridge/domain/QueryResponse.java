package com.rizilab.averroes.bridge.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Answer produced once per completed request, streaming or not.
 */
@Value
@Builder(toBuilder = true)
public class QueryResponse {

    public static final String FALLBACK_SOURCE = "fallback";

    String id;
    String text;
    double confidence;
    @Singular
    List<String> sources;
    @Singular
    List<String> followUps;
    Instant createdAt;
    String analysisId;

    public boolean isFallback() {
        return sources.size() == 1 && FALLBACK_SOURCE.equals(sources.get(0));
    }
}
