package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.AggregationResult;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import com.rizilab.averroes.bridge.domain.StreamChunk;
import com.rizilab.averroes.bridge.exception.ProtocolViolationException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates the chunks of one streamed request.
 *
 * <p>Chunks must arrive with sequence 0, 1, 2... A gap or repeat fails the aggregation.
 * Once final (completed or failed) the aggregation ignores every further call and keeps
 * returning its terminal snapshot.
 */
@Slf4j
public class ChunkAggregator {

    private final ReentrantLock lock = new ReentrantLock();
    private final StringBuilder buffer = new StringBuilder();

    private long nextSequence;
    private int chunkCount;
    private AggregationResult terminal;

    public AggregationResult feed(StreamChunk chunk) {
        lock.lock();
        try {
            if (terminal != null) {
                return terminal;
            }
            if (chunk.getSequence() != nextSequence) {
                ProtocolViolationException violation =
                        new ProtocolViolationException(nextSequence, chunk.getSequence());
                terminal = AggregationResult.failed(buffer.toString(), violation.getErrorInfo());
                log.warn("Chunk sequence broken: expected={}, actual={}", nextSequence, chunk.getSequence());
                throw violation;
            }
            buffer.append(chunk.getContent());
            nextSequence++;
            chunkCount++;
            return AggregationResult.partial(buffer.toString());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finalizes with the completion response. Its text replaces whatever was buffered.
     */
    public AggregationResult complete(QueryResponse response) {
        lock.lock();
        try {
            if (terminal == null) {
                if (!response.getText().equals(buffer.toString())) {
                    log.debug("Completion text differs from buffered chunks: buffered={}, final={}",
                            buffer.length(), response.getText().length());
                }
                terminal = AggregationResult.completed(response);
            }
            return terminal;
        } finally {
            lock.unlock();
        }
    }

    public AggregationResult fail(ErrorInfo error) {
        lock.lock();
        try {
            if (terminal == null) {
                terminal = AggregationResult.failed(buffer.toString(), error);
            }
            return terminal;
        } finally {
            lock.unlock();
        }
    }

    public AggregationResult snapshot() {
        lock.lock();
        try {
            return terminal != null ? terminal : AggregationResult.partial(buffer.toString());
        } finally {
            lock.unlock();
        }
    }

    public boolean isFinal() {
        lock.lock();
        try {
            return terminal != null;
        } finally {
            lock.unlock();
        }
    }

    public int chunkCount() {
        lock.lock();
        try {
            return chunkCount;
        } finally {
            lock.unlock();
        }
    }
}
