package com.rizilab.averroes.bridge.exception;

import com.rizilab.averroes.bridge.domain.ErrorInfo;

/**
 * A chunk arrived out of sequence. The aggregation it belongs to is already failed.
 */
public class ProtocolViolationException extends BridgeException {

    private final long expectedSequence;
    private final long actualSequence;

    public ProtocolViolationException(long expectedSequence, long actualSequence) {
        super(ErrorInfo.protocolViolation(
                "expected chunk " + expectedSequence + " but received " + actualSequence));
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public long getExpectedSequence() {
        return expectedSequence;
    }

    public long getActualSequence() {
        return actualSequence;
    }
}
