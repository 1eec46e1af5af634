package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import com.rizilab.averroes.bridge.domain.StreamChunk;
import com.rizilab.averroes.bridge.infrastructure.StreamCallback;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replays a fallback answer as a stream of word chunks at a fixed cadence, so clients see the
 * same chunk-then-complete shape as a native stream.
 */
@Slf4j
@Component
public class FallbackStreamer {

    private static final Pattern WORD = Pattern.compile("\\s*\\S+\\s*");

    private final ScheduledExecutorService scheduler;
    private final MetricsService metricsService;
    private final long chunkDelayMillis;

    public FallbackStreamer(@Qualifier("bridgeScheduler") ScheduledExecutorService scheduler,
                            MetricsService metricsService,
                            @Value("${averroes.fallback.chunk-delay-ms:40}") long chunkDelayMillis) {
        this.scheduler = scheduler;
        this.metricsService = metricsService;
        this.chunkDelayMillis = Math.max(0, chunkDelayMillis);
    }

    public Replay stream(QueryResponse response, StreamCallback callback) {
        Replay replay = new Replay(response, split(response.getText()), callback);
        replay.scheduleNext(0);
        return replay;
    }

    /**
     * Splits text into word chunks whose concatenation is the original text.
     */
    static List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        int end = 0;
        while (matcher.find()) {
            chunks.add(matcher.group());
            end = matcher.end();
        }
        if (end < text.length()) {
            // trailing whitespace only
            if (chunks.isEmpty()) {
                chunks.add(text.substring(end));
            } else {
                int last = chunks.size() - 1;
                chunks.set(last, chunks.get(last) + text.substring(end));
            }
        }
        return chunks;
    }

    /**
     * One fallback answer being replayed.
     */
    public final class Replay {

        private final QueryResponse response;
        private final List<String> chunks;
        private final StreamCallback callback;
        private final ChunkAggregator aggregator = new ChunkAggregator();
        private final long startedAt = System.nanoTime();

        private int next;
        private ScheduledFuture<?> pending;

        private Replay(QueryResponse response, List<String> chunks, StreamCallback callback) {
            this.response = response;
            this.chunks = chunks;
            this.callback = callback;
        }

        /**
         * Stops the replay; the callback receives a CALL_CANCELLED error unless it already finished.
         */
        public synchronized void cancel() {
            if (aggregator.isFinal()) {
                return;
            }
            terminate(ErrorInfo.cancelled());
        }

        public boolean isFinished() {
            return aggregator.isFinal();
        }

        private synchronized void scheduleNext(long delayMillis) {
            if (aggregator.isFinal()) {
                return;
            }
            pending = scheduler.schedule(this::emit, delayMillis, TimeUnit.MILLISECONDS);
        }

        private synchronized void emit() {
            if (aggregator.isFinal()) {
                return;
            }
            if (next < chunks.size()) {
                String content = chunks.get(next);
                String accumulated = aggregator.feed(StreamChunk.of(next, content)).getAccumulatedText();
                next++;
                try {
                    callback.onChunk(accumulated);
                } catch (RuntimeException e) {
                    log.error("Fallback stream consumer failed on chunk: responseId={}, chunk={}",
                            response.getId(), next - 1, e);
                    terminate(ErrorInfo.deliveryFailed(e));
                    return;
                }
                scheduleNext(chunkDelayMillis);
                return;
            }
            aggregator.complete(response);
            metricsService.recordStreamCompleted("fallback",
                    Duration.ofNanos(System.nanoTime() - startedAt), chunks.size());
            log.debug("Fallback stream completed: responseId={}, chunks={}", response.getId(), chunks.size());
            try {
                callback.onComplete(response);
            } catch (RuntimeException e) {
                log.error("Fallback stream consumer failed on completion: responseId={}", response.getId(), e);
            }
        }

        private void terminate(ErrorInfo error) {
            if (pending != null) {
                pending.cancel(false);
            }
            aggregator.fail(error);
            metricsService.recordStreamError("fallback", error.getKind().name());
            try {
                callback.onError(error);
            } catch (RuntimeException e) {
                log.error("Fallback stream consumer failed on error: kind={}", error.getKind(), e);
            }
        }
    }
}
