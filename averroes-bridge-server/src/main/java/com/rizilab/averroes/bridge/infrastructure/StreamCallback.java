package com.rizilab.averroes.bridge.infrastructure;

import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.QueryResponse;

import java.util.function.Consumer;

/**
 * Callback interface for streaming events.
 *
 * {@code onChunk} receives the accumulated text so far. Exactly one of {@code onComplete}
 * or {@code onError} ends the stream.
 */
public interface StreamCallback {
    void onChunk(String accumulatedText);
    void onComplete(QueryResponse response);
    void onError(ErrorInfo error);

    static StreamCallback of(Consumer<String> onChunk,
                             Consumer<QueryResponse> onComplete,
                             Consumer<ErrorInfo> onError) {
        return new StreamCallback() {
            @Override
            public void onChunk(String accumulatedText) {
                onChunk.accept(accumulatedText);
            }

            @Override
            public void onComplete(QueryResponse response) {
                onComplete.accept(response);
            }

            @Override
            public void onError(ErrorInfo error) {
                onError.accept(error);
            }
        };
    }
}
