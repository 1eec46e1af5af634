package com.rizilab.averroes.bridge.infrastructure;

import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.domain.CallResult;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.StreamChunk;
import com.rizilab.averroes.bridge.domain.SystemHandle;
import com.rizilab.averroes.bridge.exception.BridgeException;
import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs single calls against the native core and turns its poll/complete/free protocol into
 * {@link CompletableFuture}s and ordered stream callbacks.
 *
 * <p>Every native future handed to {@link #await} is freed exactly once: on completion, on
 * native error, on timeout, when the returned future is cancelled, and on {@link #cancelAll()}.
 * Every stream started with {@link #callStreaming} ends with exactly one terminal callback.
 */
@Slf4j
@Component
public class NativeCallAdapter {

    private final NativeBoundary boundary;
    private final ScheduledExecutorService scheduler;
    private final MetricsService metricsService;
    private final long pollIntervalMillis;

    private final Set<InFlightCall> inFlight = ConcurrentHashMap.newKeySet();

    public NativeCallAdapter(NativeBoundary boundary,
                             @Qualifier("bridgeScheduler") ScheduledExecutorService scheduler,
                             MetricsService metricsService,
                             CoreProperties properties) {
        this.boundary = boundary;
        this.scheduler = scheduler;
        this.metricsService = metricsService;
        this.pollIntervalMillis = Math.max(1, properties.getPollInterval().toMillis());
    }

    /**
     * Waits for a native future without blocking the caller.
     *
     * @param label operation name used in logs, metrics and timeout messages
     */
    public <T> CompletableFuture<CallResult<T>> await(NativeFuture<T> nativeFuture, Duration timeout, String label) {
        PendingCall<T> call = new PendingCall<>(nativeFuture, timeout, label);
        inFlight.add(call);
        call.start();
        return call.result;
    }

    /**
     * Invokes {@code operation} once and waits for its JSON result.
     */
    public CompletableFuture<CallResult<String>> callOnce(SystemHandle handle,
                                                          String operation,
                                                          String argsJson,
                                                          Duration timeout) {
        NativeFuture<String> nativeFuture;
        try {
            nativeFuture = boundary.invoke(handle, operation, argsJson);
        } catch (NativeCallException e) {
            log.warn("Native core rejected call: operation={}, code={}, message={}",
                    operation, e.getCode(), e.getMessage());
            metricsService.recordNativeCall(operation, "rejected", Duration.ZERO);
            return CompletableFuture.completedFuture(CallResult.failure(toErrorInfo(e)));
        }
        return await(nativeFuture, timeout, operation);
    }

    /**
     * Starts a streaming operation. Chunks reach {@code onChunk} in native order, then exactly one
     * of {@code onComplete} (with the JSON completion payload) or {@code onError} fires.
     * A {@link BridgeException} thrown by {@code onChunk} ends the stream with its error.
     */
    public StreamCall callStreaming(SystemHandle handle,
                                    String operation,
                                    String argsJson,
                                    Duration timeout,
                                    Consumer<StreamChunk> onChunk,
                                    Consumer<String> onComplete,
                                    Consumer<ErrorInfo> onError) {
        StreamCall call = new StreamCall(operation, onChunk, onComplete, onError);
        inFlight.add(call);
        call.armTimeout(timeout);
        try {
            NativeStreamRegistration registration = boundary.invokeStreaming(handle, operation, argsJson, call.sink());
            call.attach(registration);
        } catch (NativeCallException e) {
            log.warn("Native core rejected stream: operation={}, code={}, message={}",
                    operation, e.getCode(), e.getMessage());
            call.fail(toErrorInfo(e));
        } catch (RuntimeException e) {
            log.error("Native stream could not be started: operation={}", operation, e);
            call.fail(ErrorInfo.nativeReported(ErrorInfo.NO_CODE, String.valueOf(e.getMessage())));
        }
        return call;
    }

    /**
     * Aborts every call still in flight. Pending results complete with CALL_CANCELLED and
     * streams receive a synthesized cancellation error.
     *
     * @return number of calls aborted
     */
    public int cancelAll() {
        List<InFlightCall> snapshot = new ArrayList<>(inFlight);
        snapshot.forEach(InFlightCall::abort);
        if (!snapshot.isEmpty()) {
            log.info("Cancelled {} in-flight native calls", snapshot.size());
        }
        return snapshot.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public static ErrorInfo toErrorInfo(NativeCallException e) {
        String prefix;
        switch (e.getCode()) {
            case NativeCallException.INITIALIZATION_ERROR:
                prefix = "Initialization error";
                break;
            case NativeCallException.AI_ERROR:
                prefix = "AI error";
                break;
            case NativeCallException.INVALID_QUERY:
                prefix = "Invalid query";
                break;
            default:
                prefix = "Native error";
        }
        return ErrorInfo.nativeReported(e.getCode(), prefix + ": " + e.getMessage());
    }

    interface InFlightCall {
        void abort();
    }

    /**
     * One native future being polled. Poll, complete, cancel and free all happen under this
     * object's monitor, so a free can never overlap a poll.
     */
    private final class PendingCall<T> implements InFlightCall {

        private final NativeFuture<T> nativeFuture;
        private final Duration timeout;
        private final String label;
        private final CompletableFuture<CallResult<T>> result = new CompletableFuture<>();
        private final long startedAt = System.nanoTime();

        private ScheduledFuture<?> pollTask;
        private ScheduledFuture<?> timeoutTask;
        private boolean released;

        PendingCall(NativeFuture<T> nativeFuture, Duration timeout, String label) {
            this.nativeFuture = nativeFuture;
            this.timeout = timeout;
            this.label = label;
        }

        void start() {
            // runs on the cancelling thread, before cancel() returns
            result.whenComplete((value, error) -> {
                if (result.isCancelled()) {
                    onCallerCancelled();
                }
            });
            synchronized (this) {
                if (released) {
                    return;
                }
                pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0, pollIntervalMillis, TimeUnit.MILLISECONDS);
                timeoutTask = scheduler.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        private void poll() {
            CallResult<T> outcome;
            synchronized (this) {
                if (released) {
                    return;
                }
                try {
                    if (nativeFuture.poll() == NativePoll.PENDING) {
                        return;
                    }
                    outcome = CallResult.success(nativeFuture.complete());
                } catch (NativeCallException e) {
                    log.warn("Native call failed: operation={}, code={}, message={}", label, e.getCode(), e.getMessage());
                    outcome = CallResult.failure(toErrorInfo(e));
                } catch (RuntimeException e) {
                    log.error("Native call crashed while polling: operation={}", label, e);
                    outcome = CallResult.failure(ErrorInfo.nativeReported(ErrorInfo.NO_CODE, String.valueOf(e.getMessage())));
                }
                releaseLocked(false);
            }
            finish(outcome, outcome.isSuccess() ? "success" : "error");
        }

        private void expire() {
            synchronized (this) {
                if (released) {
                    return;
                }
                releaseLocked(true);
            }
            log.warn("Native call timed out: operation={}, timeout={}ms", label, timeout.toMillis());
            finish(CallResult.failure(ErrorInfo.timeout(label, timeout.toMillis())), "timeout");
        }

        private void onCallerCancelled() {
            synchronized (this) {
                if (released) {
                    return;
                }
                releaseLocked(true);
            }
            log.info("Native call cancelled by caller: operation={}", label);
            metricsService.recordNativeCall(label, "cancelled", elapsed());
        }

        @Override
        public void abort() {
            synchronized (this) {
                if (released) {
                    return;
                }
                releaseLocked(true);
            }
            finish(CallResult.failure(ErrorInfo.cancelled()), "cancelled");
        }

        private void releaseLocked(boolean cancelNative) {
            released = true;
            if (pollTask != null) {
                pollTask.cancel(false);
            }
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            try {
                if (cancelNative) {
                    nativeFuture.cancel();
                }
            } catch (RuntimeException e) {
                log.error("Native cancel failed: operation={}", label, e);
            } finally {
                try {
                    nativeFuture.free();
                } catch (RuntimeException e) {
                    log.error("Native free failed: operation={}", label, e);
                }
                inFlight.remove(this);
                metricsService.recordNativeFutureReleased(cancelNative);
            }
        }

        private void finish(CallResult<T> outcome, String metricOutcome) {
            metricsService.recordNativeCall(label, metricOutcome, elapsed());
            result.complete(outcome);
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedAt);
        }
    }

    /**
     * A running native stream. Delivery and termination are serialized on this object so no
     * chunk can follow the terminal callback.
     */
    public final class StreamCall implements InFlightCall {

        private final String operation;
        private final Consumer<StreamChunk> onChunk;
        private final Consumer<String> onComplete;
        private final Consumer<ErrorInfo> onError;

        private NativeStreamRegistration registration;
        private ScheduledFuture<?> timeoutTask;
        private boolean terminated;
        private boolean nativeCancelPending;

        private StreamCall(String operation,
                           Consumer<StreamChunk> onChunk,
                           Consumer<String> onComplete,
                           Consumer<ErrorInfo> onError) {
            this.operation = operation;
            this.onChunk = onChunk;
            this.onComplete = onComplete;
            this.onError = onError;
        }

        public String operation() {
            return operation;
        }

        public synchronized boolean isTerminated() {
            return terminated;
        }

        /**
         * Stops the stream; the caller receives a CALL_CANCELLED error unless it already terminated.
         */
        public void cancel() {
            terminate(ErrorInfo.cancelled(), true);
        }

        @Override
        public void abort() {
            cancel();
        }

        NativeStreamSink sink() {
            return new NativeStreamSink() {
                @Override
                public void onChunk(long sequence, String content) {
                    deliverChunk(sequence, content);
                }

                @Override
                public void onComplete(String payload) {
                    complete(payload);
                }

                @Override
                public void onError(int code, String message) {
                    fail(toErrorInfo(new NativeCallException(code, message)));
                }
            };
        }

        synchronized void armTimeout(Duration timeout) {
            timeoutTask = scheduler.schedule(
                    () -> terminate(ErrorInfo.timeout(operation, timeout.toMillis()), true),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        void attach(NativeStreamRegistration registration) {
            boolean cancelNow;
            synchronized (this) {
                this.registration = registration;
                cancelNow = nativeCancelPending;
            }
            if (cancelNow) {
                cancelRegistration(registration);
            }
        }

        void fail(ErrorInfo error) {
            terminate(error, false);
        }

        private synchronized void deliverChunk(long sequence, String content) {
            if (terminated) {
                log.debug("Dropping chunk after termination: operation={}, sequence={}", operation, sequence);
                return;
            }
            if (sequence < 0) {
                terminate(ErrorInfo.protocolViolation("negative chunk sequence " + sequence), true);
                return;
            }
            try {
                onChunk.accept(StreamChunk.of(sequence, content));
            } catch (BridgeException e) {
                log.warn("Stream consumer rejected chunk: operation={}, sequence={}, reason={}",
                        operation, sequence, e.getMessage());
                terminate(e.getErrorInfo(), true);
            } catch (RuntimeException e) {
                log.error("Stream consumer failed on chunk: operation={}, sequence={}", operation, sequence, e);
                terminate(ErrorInfo.deliveryFailed(e), true);
            }
        }

        private void complete(String payload) {
            synchronized (this) {
                if (!markTerminated(false)) {
                    return;
                }
                try {
                    onComplete.accept(payload);
                } catch (RuntimeException e) {
                    log.error("Stream consumer failed on completion: operation={}", operation, e);
                }
            }
        }

        private void terminate(ErrorInfo error, boolean cancelNative) {
            NativeStreamRegistration toCancel;
            synchronized (this) {
                if (!markTerminated(cancelNative)) {
                    return;
                }
                toCancel = cancelNative ? registration : null;
                try {
                    onError.accept(error);
                } catch (RuntimeException e) {
                    log.error("Stream consumer failed on error: operation={}, kind={}", operation, error.getKind(), e);
                }
            }
            if (toCancel != null) {
                cancelRegistration(toCancel);
            }
        }

        private boolean markTerminated(boolean cancelNative) {
            if (terminated) {
                return false;
            }
            terminated = true;
            if (cancelNative && registration == null) {
                nativeCancelPending = true;
            }
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            inFlight.remove(this);
            return true;
        }

        private void cancelRegistration(NativeStreamRegistration target) {
            try {
                target.cancel();
            } catch (RuntimeException e) {
                log.error("Native stream cancel failed: operation={}", operation, e);
            }
        }
    }
}
