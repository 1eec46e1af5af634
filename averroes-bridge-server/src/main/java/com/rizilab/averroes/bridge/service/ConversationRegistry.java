package com.rizilab.averroes.bridge.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Tracks the active stream turn of each conversation.
 *
 * Starting a turn supersedes the previous one: its stream is cancelled and its callbacks are
 * dropped. Idle conversations are evicted after {@code averroes.conversation.idle-expiry-minutes}.
 */
@Slf4j
@Component
public class ConversationRegistry {

    private static final long MAXIMUM_CONVERSATIONS = 10_000;

    private final Cache<String, ConversationTurn> activeTurns;
    private final MetricsService metricsService;

    @Autowired
    public ConversationRegistry(@Value("${averroes.conversation.idle-expiry-minutes:30}") long idleExpiryMinutes,
                                MetricsService metricsService) {
        this(Duration.ofMinutes(idleExpiryMinutes), MAXIMUM_CONVERSATIONS, ForkJoinPool.commonPool(), metricsService);
    }

    ConversationRegistry(Duration idleExpiry, long maximumSize, Executor executor, MetricsService metricsService) {
        this.metricsService = metricsService;
        this.activeTurns = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterAccess(idleExpiry)
            .executor(executor)
            .removalListener(this::onRemoval)
            .build();
    }

    // an evicted turn can no longer be superseded, so its stream is stopped here
    private void onRemoval(String conversationId, ConversationTurn turn, RemovalCause cause) {
        if (turn != null && cause.wasEvicted()) {
            log.warn("Evicting active stream: conversationId={}, cause={}", conversationId, cause);
            turn.cancel();
        }
    }

    public ConversationTurn begin(String conversationId) {
        ConversationTurn turn = new ConversationTurn(conversationId);
        ConversationTurn previous = activeTurns.asMap().put(conversationId, turn);
        if (previous != null) {
            log.info("Superseding active stream: conversationId={}", conversationId);
            metricsService.recordStreamSuperseded();
            previous.supersede();
        }
        return turn;
    }

    /**
     * Forgets {@code turn} if it is still the active one of its conversation.
     */
    public void finish(ConversationTurn turn) {
        if (turn.getConversationId() != null) {
            activeTurns.asMap().remove(turn.getConversationId(), turn);
        }
    }

    /**
     * Cancels the active turn of a conversation; its callback still receives the cancellation.
     *
     * @return true if a turn was active
     */
    public boolean cancel(String conversationId) {
        ConversationTurn turn = activeTurns.asMap().remove(conversationId);
        if (turn == null) {
            return false;
        }
        log.info("Cancelling active stream: conversationId={}", conversationId);
        turn.cancel();
        return true;
    }

    public long activeCount() {
        activeTurns.cleanUp();
        return activeTurns.estimatedSize();
    }
}
