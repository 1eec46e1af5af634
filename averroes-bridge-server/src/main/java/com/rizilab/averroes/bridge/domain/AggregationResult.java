package com.rizilab.averroes.bridge.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Snapshot of a {@code ChunkAggregator}.
 *
 * A final snapshot carries either the response or the error.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AggregationResult {

    private final String accumulatedText;
    private final boolean isFinal;
    private final QueryResponse response;
    private final ErrorInfo error;

    public static AggregationResult partial(String accumulatedText) {
        return new AggregationResult(accumulatedText, false, null, null);
    }

    public static AggregationResult completed(QueryResponse response) {
        return new AggregationResult(response.getText(), true, response, null);
    }

    public static AggregationResult failed(String accumulatedText, ErrorInfo error) {
        return new AggregationResult(accumulatedText, true, null, error);
    }

    public Optional<QueryResponse> response() {
        return Optional.ofNullable(response);
    }

    public Optional<ErrorInfo> error() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return isFinal && error != null;
    }
}
