package com.rizilab.averroes.bridge.domain;

import lombok.Value;

/**
 * One ordered fragment of a streamed answer.
 *
 * Sequence numbers start at 0 and grow by exactly one per chunk of a request.
 */
@Value
public class StreamChunk {

    long sequence;
    String content;

    public static StreamChunk of(long sequence, String content) {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be unsigned: " + sequence);
        }
        return new StreamChunk(sequence, content != null ? content : "");
    }
}
