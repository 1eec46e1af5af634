package com.rizilab.averroes.bridge.service;

import lombok.Getter;

/**
 * One stream of a conversation. A superseded turn stays silent: its callbacks are dropped.
 */
public final class ConversationTurn {

    @Getter
    private final String conversationId;

    private volatile boolean current = true;
    private boolean cancelRequested;
    private Runnable canceller;

    ConversationTurn(String conversationId) {
        this.conversationId = conversationId;
    }

    /**
     * A turn outside any conversation; never superseded.
     */
    static ConversationTurn detached() {
        return new ConversationTurn(null);
    }

    public boolean isCurrent() {
        return current;
    }

    /**
     * Attaches the action that stops the underlying stream. Runs it at once if the turn was
     * superseded or cancelled before the stream started.
     */
    void bind(Runnable streamCanceller) {
        boolean cancelNow;
        synchronized (this) {
            canceller = streamCanceller;
            cancelNow = cancelRequested;
        }
        if (cancelNow) {
            streamCanceller.run();
        }
    }

    void supersede() {
        current = false;
        cancel();
    }

    void cancel() {
        Runnable toRun;
        synchronized (this) {
            cancelRequested = true;
            toRun = canceller;
        }
        if (toRun != null) {
            toRun.run();
        }
    }
}
