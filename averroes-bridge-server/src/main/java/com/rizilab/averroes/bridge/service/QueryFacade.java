package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.domain.AggregationResult;
import com.rizilab.averroes.bridge.domain.CallResult;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.ErrorKind;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import com.rizilab.averroes.bridge.domain.SystemHandle;
import com.rizilab.averroes.bridge.infrastructure.NativeCallAdapter;
import com.rizilab.averroes.bridge.infrastructure.NativePayloadCodec;
import com.rizilab.averroes.bridge.infrastructure.StreamCallback;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Entry point for analysis requests.
 *
 * <p>Routes each request to the native core when the lifecycle is ready and to the fallback
 * generator otherwise. Both paths produce the same result and stream shapes.
 */
@Slf4j
@Service
public class QueryFacade {

    static final String NATIVE_PATH = "native";
    static final String FALLBACK_PATH = "fallback";

    private final SystemLifecycle lifecycle;
    private final NativeCallAdapter callAdapter;
    private final NativePayloadCodec codec;
    private final ConversationRegistry conversations;
    private final FallbackStreamer fallbackStreamer;
    private final MetricsService metricsService;
    private final CoreProperties properties;

    @Autowired(required = false)
    private FallbackResponseGenerator fallbackGenerator;

    public QueryFacade(SystemLifecycle lifecycle,
                       NativeCallAdapter callAdapter,
                       NativePayloadCodec codec,
                       ConversationRegistry conversations,
                       FallbackStreamer fallbackStreamer,
                       MetricsService metricsService,
                       CoreProperties properties) {
        this.lifecycle = lifecycle;
        this.callAdapter = callAdapter;
        this.codec = codec;
        this.conversations = conversations;
        this.fallbackStreamer = fallbackStreamer;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    void setFallbackGenerator(FallbackResponseGenerator fallbackGenerator) {
        this.fallbackGenerator = fallbackGenerator;
    }

    /**
     * Answers a request in one piece. Cancelling the returned future cancels the native call.
     */
    public CompletableFuture<CallResult<QueryResponse>> analyze(QueryRequest request) {
        if (request.isEmpty()) {
            return CompletableFuture.completedFuture(CallResult.failure(emptyPayload(request)));
        }

        Optional<SystemHandle> handle = readyHandle();
        if (handle.isEmpty()) {
            return CompletableFuture.completedFuture(fallback(request));
        }

        String operation = NativeOperation.forKind(request.getKind()).single();
        log.info("Native analysis: operation={}, payloadSize={}", operation, request.payloadSize());
        CompletableFuture<CallResult<String>> call = callAdapter.callOnce(
                handle.get(), operation, codec.encodeArgs(request), properties.getCallTimeout());

        CompletableFuture<CallResult<QueryResponse>> result =
                call.thenApply(raw -> raw.flatMap(codec::decodeResponse));
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                call.cancel(false);
            }
        });
        return result;
    }

    /**
     * Streams an answer. {@code callback.onChunk} receives the accumulated text; exactly one
     * terminal callback follows unless the stream is superseded by a newer one on the same
     * conversation, in which case the callback goes silent.
     */
    public StreamSubscription analyzeStream(QueryRequest request, StreamCallback callback) {
        ConversationTurn turn = request.conversationId()
                .map(conversations::begin)
                .orElseGet(ConversationTurn::detached);
        StreamCallback guarded = guard(turn, callback);

        if (request.isEmpty()) {
            guarded.onError(emptyPayload(request));
            return new StreamSubscription(turn, FALLBACK_PATH);
        }

        Optional<SystemHandle> handle = readyHandle();
        if (handle.isPresent()) {
            streamNative(handle.get(), request, turn, guarded);
            return new StreamSubscription(turn, NATIVE_PATH);
        }
        streamFallback(request, turn, guarded);
        return new StreamSubscription(turn, FALLBACK_PATH);
    }

    public StreamSubscription analyzeStream(QueryRequest request,
                                            Consumer<String> onChunk,
                                            Consumer<QueryResponse> onComplete,
                                            Consumer<ErrorInfo> onError) {
        return analyzeStream(request, StreamCallback.of(onChunk, onComplete, onError));
    }

    /**
     * Cancels the active stream of a conversation, if any.
     */
    public boolean cancelConversation(String conversationId) {
        return conversations.cancel(conversationId);
    }

    private void streamNative(SystemHandle handle, QueryRequest request, ConversationTurn turn, StreamCallback callback) {
        String operation = NativeOperation.forKind(request.getKind()).streaming();
        ChunkAggregator aggregator = new ChunkAggregator();
        long startedAt = System.nanoTime();
        metricsService.recordStreamStarted(NATIVE_PATH);
        log.info("Native stream: operation={}, conversationId={}", operation, turn.getConversationId());

        NativeCallAdapter.StreamCall call = callAdapter.callStreaming(
                handle,
                operation,
                codec.encodeArgs(request),
                properties.getStreamTimeout(),
                chunk -> callback.onChunk(aggregator.feed(chunk).getAccumulatedText()),
                payload -> {
                    CallResult<QueryResponse> decoded = codec.decodeResponse(payload);
                    if (decoded.isSuccess()) {
                        AggregationResult done = aggregator.complete(decoded.getValue());
                        metricsService.recordStreamCompleted(NATIVE_PATH,
                                Duration.ofNanos(System.nanoTime() - startedAt), aggregator.chunkCount());
                        callback.onComplete(done.getResponse());
                    } else {
                        failStream(aggregator, decoded.getError(), callback);
                    }
                },
                error -> failStream(aggregator, error, callback));
        turn.bind(call::cancel);
    }

    private void failStream(ChunkAggregator aggregator, ErrorInfo error, StreamCallback callback) {
        // a sequence violation already failed the aggregation; report that instead of the cancel
        ErrorInfo reported = aggregator.fail(error).error().orElse(error);
        metricsService.recordStreamError(NATIVE_PATH, reported.getKind().name());
        callback.onError(reported);
    }

    private void streamFallback(QueryRequest request, ConversationTurn turn, StreamCallback callback) {
        if (fallbackGenerator == null) {
            callback.onError(notInitialized());
            return;
        }
        metricsService.recordStreamStarted(FALLBACK_PATH);
        metricsService.recordFallback(request.getKind().name());
        QueryResponse response = fallbackGenerator.generate(request);
        log.info("Fallback stream: kind={}, conversationId={}", request.getKind(), turn.getConversationId());
        FallbackStreamer.Replay replay = fallbackStreamer.stream(response, callback);
        turn.bind(replay::cancel);
    }

    private CallResult<QueryResponse> fallback(QueryRequest request) {
        if (fallbackGenerator == null) {
            log.warn("Native core not ready and no fallback configured: state={}", lifecycle.state().getStatus());
            return CallResult.failure(notInitialized());
        }
        metricsService.recordFallback(request.getKind().name());
        log.info("Fallback analysis: kind={}, state={}", request.getKind(), lifecycle.state().getStatus());
        return CallResult.success(fallbackGenerator.generate(request));
    }

    private Optional<SystemHandle> readyHandle() {
        if (!lifecycle.isReady()) {
            return Optional.empty();
        }
        return lifecycle.currentHandle();
    }

    private StreamCallback guard(ConversationTurn turn, StreamCallback delegate) {
        return new StreamCallback() {
            @Override
            public void onChunk(String accumulatedText) {
                if (turn.isCurrent()) {
                    delegate.onChunk(accumulatedText);
                }
            }

            @Override
            public void onComplete(QueryResponse response) {
                conversations.finish(turn);
                if (turn.isCurrent()) {
                    delegate.onComplete(response);
                }
            }

            @Override
            public void onError(ErrorInfo error) {
                conversations.finish(turn);
                if (turn.isCurrent()) {
                    delegate.onError(error);
                }
            }
        };
    }

    private static ErrorInfo emptyPayload(QueryRequest request) {
        return ErrorInfo.invalidQuery(request.getKind() + " request has an empty payload");
    }

    private ErrorInfo notInitialized() {
        return ErrorInfo.of(ErrorKind.NOT_INITIALIZED,
                "native core is " + lifecycle.state().getStatus() + " and no fallback is configured");
    }
}
