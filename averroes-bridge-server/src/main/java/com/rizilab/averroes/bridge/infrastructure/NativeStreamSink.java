package com.rizilab.averroes.bridge.infrastructure;

/**
 * Callback object registered with the native core for a streaming operation.
 *
 * The core calls {@link #onChunk} zero or more times, then exactly one of
 * {@link #onComplete} or {@link #onError}.
 */
public interface NativeStreamSink {

    void onChunk(long sequence, String content);

    /**
     * @param payload JSON encoded final response, authoritative over the chunks
     */
    void onComplete(String payload);

    void onError(int code, String message);
}
