package com.rizilab.averroes.bridge.service;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based metrics for the bridge.
 *
 * Counters and gauges are kept in memory and logged; tags are folded into the metric key
 * so they can be read back in diagnostics and tests.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(key(name, tags));
    }

    // ===== Timer Metrics =====

    public void recordTimer(String name, Duration duration, Tags tags) {
        log.debug("[METRIC] Timer: {} = {}ms", key(name, tags), duration.toMillis());
    }

    // ===== Gauge Metrics =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Bridge Metrics =====

    public void recordInitialization(String outcome, Duration duration) {
        Tags tags = Tags.of("outcome", outcome);
        incrementCounter("lifecycle.init", tags);
        recordTimer("lifecycle.init.duration", duration, tags);
        log.info("Lifecycle initialization finished: outcome={}, duration={}ms", outcome, duration.toMillis());
    }

    public void recordNativeCall(String operation, String outcome, Duration duration) {
        Tags tags = Tags.of("operation", operation, "outcome", outcome);
        incrementCounter("native.calls", tags);
        recordTimer("native.calls.duration", duration, tags);
    }

    public void recordNativeFutureReleased(boolean cancelled) {
        incrementCounter("native.futures.released", Tags.of("cancelled", String.valueOf(cancelled)));
    }

    public void recordFallback(String kind) {
        incrementCounter("fallback.responses", Tags.of("kind", kind));
    }

    public void recordStreamStarted(String path) {
        incrementCounter("stream.started", Tags.of("path", path));
        incrementGauge("stream.active");
    }

    public void recordStreamCompleted(String path, Duration duration, long chunkCount) {
        incrementCounter("stream.completed", Tags.of("path", path));
        decrementGauge("stream.active");
        recordTimer("stream.duration", duration, Tags.of("path", path));
        log.info("Stream completed: path={}, duration={}ms, chunks={}", path, duration.toMillis(), chunkCount);
    }

    public void recordStreamError(String path, String errorKind) {
        incrementCounter("stream.errors", Tags.of("path", path, "error", errorKind));
        decrementGauge("stream.active");
    }

    public void recordStreamSuperseded() {
        incrementCounter("stream.superseded");
    }

    // ===== Utility Methods =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public long getCounterValue(String name, Tags tags) {
        return getCounterValue(key(name, tags));
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    public void printSummary() {
        log.info("=== Metrics Summary ===");
        counters.forEach((name, value) -> log.info("  {} = {}", name, value.get()));
        gauges.forEach((name, value) -> log.info("  {} = {}", name, value.get()));
        log.info("=====================");
    }

    private static String key(String name, Tags tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append(',').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return key.toString();
    }
}
