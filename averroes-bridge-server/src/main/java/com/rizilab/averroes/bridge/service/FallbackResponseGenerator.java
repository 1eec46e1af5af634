package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;

/**
 * Produces answers without the native core. Responses carry {@code sources == ["fallback"]}
 * and a confidence of at most {@link #MAX_CONFIDENCE}.
 */
public interface FallbackResponseGenerator {

    double MAX_CONFIDENCE = 0.7;

    QueryResponse generate(QueryRequest request);
}
