package com.rizilab.averroes.bridge.service;

import java.util.Optional;

/**
 * Handle on a stream started by {@link QueryFacade#analyzeStream}.
 */
public final class StreamSubscription {

    private final ConversationTurn turn;
    private final String path;

    StreamSubscription(ConversationTurn turn, String path) {
        this.turn = turn;
        this.path = path;
    }

    /**
     * Cancels the stream. Unless it already ended, the callback receives a CALL_CANCELLED error.
     */
    public void cancel() {
        turn.cancel();
    }

    public Optional<String> conversationId() {
        return Optional.ofNullable(turn.getConversationId());
    }

    /**
     * {@code native} or {@code fallback}.
     */
    public String path() {
        return path;
    }

    public boolean isSuperseded() {
        return !turn.isCurrent();
    }
}
