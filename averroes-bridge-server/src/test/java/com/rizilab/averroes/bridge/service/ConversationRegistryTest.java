package com.rizilab.averroes.bridge.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationRegistryTest {

    @Test
    void beginSupersedesPreviousTurn() {
        ConversationRegistry registry = new ConversationRegistry(30, new MetricsService());
        AtomicInteger cancelled = new AtomicInteger();

        ConversationTurn first = registry.begin("conv-1");
        first.bind(cancelled::incrementAndGet);
        ConversationTurn second = registry.begin("conv-1");

        assertFalse(first.isCurrent());
        assertTrue(second.isCurrent());
        assertEquals(1, cancelled.get());
    }

    @Test
    void finishingStaleTurnKeepsNewerOne() {
        ConversationRegistry registry = new ConversationRegistry(30, new MetricsService());
        ConversationTurn first = registry.begin("conv-2");
        registry.begin("conv-2");

        registry.finish(first);

        assertEquals(1, registry.activeCount());
        assertTrue(registry.cancel("conv-2"));
        assertFalse(registry.cancel("conv-2"));
    }

    @Test
    void sizeEvictionCancelsEvictedTurn() {
        ConversationRegistry registry = new ConversationRegistry(
                Duration.ofMinutes(30), 1, Runnable::run, new MetricsService());
        AtomicInteger cancelled = new AtomicInteger();

        registry.begin("conv-a").bind(cancelled::incrementAndGet);
        registry.begin("conv-b").bind(cancelled::incrementAndGet);

        assertEquals(1, registry.activeCount());
        assertEquals(1, cancelled.get());
    }

    @Test
    void finishedTurnIsNotCancelled() {
        ConversationRegistry registry = new ConversationRegistry(
                Duration.ofMinutes(30), 10, Runnable::run, new MetricsService());
        AtomicInteger cancelled = new AtomicInteger();
        ConversationTurn turn = registry.begin("conv-c");
        turn.bind(cancelled::incrementAndGet);

        registry.finish(turn);

        assertEquals(0, registry.activeCount());
        assertEquals(0, cancelled.get());
    }
}
