package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.domain.CallResult;
import com.rizilab.averroes.bridge.domain.CoreConfig;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.ErrorKind;
import com.rizilab.averroes.bridge.domain.LifecycleState;
import com.rizilab.averroes.bridge.domain.SystemHandle;
import com.rizilab.averroes.bridge.domain.SystemStatus;
import com.rizilab.averroes.bridge.domain.ValidationResult;
import com.rizilab.averroes.bridge.exception.InitConfigInvalidException;
import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.exception.NativeUnavailableException;
import com.rizilab.averroes.bridge.infrastructure.NativeBoundary;
import com.rizilab.averroes.bridge.infrastructure.NativeCallAdapter;
import com.rizilab.averroes.bridge.infrastructure.NativeFuture;
import com.rizilab.averroes.bridge.infrastructure.NativePayloadCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the native subsystem handle and its state machine.
 *
 * <pre>
 * NOT_INITIALIZED -> INITIALIZING -> READY | DEGRADED | FAILED
 * any state -- teardown() --> NOT_INITIALIZED
 * </pre>
 *
 * Initialization is single-flight. Every attempt carries a generation number; results of an
 * attempt that a teardown has overtaken are discarded and any handle they carry is destroyed.
 */
@Slf4j
@Service
public class SystemLifecycle {

    static final String FALLBACK_AGENT = "Fallback";

    private final NativeBoundary boundary;
    private final NativeCallAdapter callAdapter;
    private final NativePayloadCodec codec;
    private final CoreConfigValidator configValidator;
    private final MetricsService metricsService;
    private final CoreProperties properties;

    private LifecycleState state = LifecycleState.notInitialized();
    private SystemHandle handle;
    private CoreConfig activeConfig;
    private CompletableFuture<LifecycleState> pendingInit;
    private CompletableFuture<CallResult<SystemHandle>> pendingConstruct;
    private long generation;

    public SystemLifecycle(NativeBoundary boundary,
                           NativeCallAdapter callAdapter,
                           NativePayloadCodec codec,
                           CoreConfigValidator configValidator,
                           MetricsService metricsService,
                           CoreProperties properties) {
        this.boundary = boundary;
        this.callAdapter = callAdapter;
        this.codec = codec;
        this.configValidator = configValidator;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    /**
     * Starts initialization, or joins the one already running.
     *
     * <p>The returned future completes with READY or DEGRADED, or exceptionally with
     * {@link InitConfigInvalidException} / {@link NativeUnavailableException} after moving to
     * FAILED. A settled lifecycle returns its current state without a new attempt.
     */
    public synchronized CompletableFuture<LifecycleState> initialize(CoreConfig config) {
        if (state.is(LifecycleState.Status.INITIALIZING) && pendingInit != null) {
            log.debug("Initialization already in progress, joining it");
            return pendingInit;
        }
        if (state.isSettled()) {
            return CompletableFuture.completedFuture(state);
        }

        long attempt = ++generation;
        long startedAt = System.nanoTime();
        CompletableFuture<LifecycleState> future = new CompletableFuture<>();
        pendingInit = future;
        state = LifecycleState.initializing();
        log.info("Initializing native core: provider={}, chain={}, storage={}",
                config.getPreferredProvider(), config.chainNetworkName(),
                config.isInMemoryStorage() ? "in-memory" : config.getStoragePath());

        ValidationResult validation = configValidator.validate(config);
        if (!validation.isValid()) {
            failNow(attempt, startedAt, new InitConfigInvalidException(validation.getErrorMessage()));
            return future;
        }

        try {
            boundary.verifyLinked();
        } catch (NativeUnavailableException e) {
            failNow(attempt, startedAt, e);
            return future;
        }

        CompletableFuture<CallResult<SystemHandle>> primary;
        try {
            primary = construct(config, properties.primaryInitBudget(), "construct");
        } catch (RuntimeException e) {
            failNow(attempt, startedAt, new InitConfigInvalidException(
                    "cannot start native core construction: " + e.getMessage(), e));
            return future;
        }
        pendingConstruct = primary;
        primary.whenComplete((result, error) -> {
            if (error == null) {
                onPrimaryResult(attempt, startedAt, config, result);
            }
        });
        return future;
    }

    public CompletableFuture<LifecycleState> restart(CoreConfig config) {
        log.info("Restarting native core");
        teardown();
        return initialize(config);
    }

    /**
     * Cancels any running initialization and in-flight calls, destroys the handle and resets to
     * NOT_INITIALIZED. Safe to call in any state, any number of times.
     */
    public void teardown() {
        CompletableFuture<CallResult<SystemHandle>> constructToCancel;
        CompletableFuture<LifecycleState> initToRelease;
        SystemHandle handleToDestroy;
        synchronized (this) {
            generation++;
            constructToCancel = pendingConstruct;
            initToRelease = pendingInit;
            handleToDestroy = handle;
            pendingConstruct = null;
            pendingInit = null;
            handle = null;
            activeConfig = null;
            if (!state.is(LifecycleState.Status.NOT_INITIALIZED)) {
                log.info("Tearing down native core: previousState={}", state.getStatus());
                state = LifecycleState.notInitialized();
            }
        }

        if (constructToCancel != null) {
            constructToCancel.cancel(false);
        }
        callAdapter.cancelAll();
        if (handleToDestroy != null) {
            destroyQuietly(handleToDestroy);
        }
        if (initToRelease != null) {
            initToRelease.complete(LifecycleState.notInitialized());
        }
    }

    public synchronized boolean isReady() {
        return state.is(LifecycleState.Status.READY) && handle != null;
    }

    public synchronized LifecycleState state() {
        return state;
    }

    public synchronized Optional<SystemHandle> currentHandle() {
        return Optional.ofNullable(handle);
    }

    public SystemStatus status() {
        LifecycleState current;
        SystemHandle currentHandle;
        CoreConfig config;
        synchronized (this) {
            current = state;
            currentHandle = handle;
            config = activeConfig;
        }

        boolean ready = current.is(LifecycleState.Status.READY) && currentHandle != null;
        String agent = FALLBACK_AGENT;
        boolean usingRealAi = false;
        if (ready) {
            try {
                agent = boundary.agentInfo(currentHandle);
                usingRealAi = boundary.usingRealAi(currentHandle);
            } catch (RuntimeException e) {
                log.warn("Could not read agent info from native core: {}", e.getMessage());
            }
        }

        return SystemStatus.builder()
                .status(current.getStatus())
                .reason(current.getReason())
                .ready(ready)
                .agent(agent)
                .usingRealAi(usingRealAi)
                .chainNetwork(ready && config != null ? config.chainNetworkName() : "disabled")
                .since(current.getSince())
                .build();
    }

    private CompletableFuture<CallResult<SystemHandle>> construct(CoreConfig config, Duration timeout, String label) {
        NativeFuture<SystemHandle> nativeFuture;
        try {
            nativeFuture = boundary.construct(codec.encodeConfig(config));
        } catch (NativeCallException e) {
            return CompletableFuture.completedFuture(CallResult.failure(NativeCallAdapter.toErrorInfo(e)));
        }
        return callAdapter.await(nativeFuture, timeout, label);
    }

    private void onPrimaryResult(long attempt, long startedAt, CoreConfig config, CallResult<SystemHandle> result) {
        if (result.isSuccess()) {
            settleReady(attempt, startedAt, config, result.getValue());
            return;
        }

        ErrorInfo error = result.getError();
        if (error.getKind() == ErrorKind.CALL_TIMEOUT) {
            if (!properties.isMinimalRetryEnabled()) {
                settleDegraded(attempt, startedAt, "initialization timed out after "
                        + properties.primaryInitBudget().toMillis() + "ms");
                return;
            }
            startMinimalAttempt(attempt, startedAt, config);
            return;
        }

        settleFailed(attempt, startedAt, new InitConfigInvalidException(error.getMessage()));
    }

    private void startMinimalAttempt(long attempt, long startedAt, CoreConfig config) {
        CoreConfig minimal = config.minimal();
        synchronized (this) {
            if (attempt != generation) {
                return;
            }
            log.warn("Native core construction timed out after {}ms, retrying with minimal configuration",
                    properties.primaryInitBudget().toMillis());
            CompletableFuture<CallResult<SystemHandle>> secondary;
            try {
                secondary = construct(minimal, properties.minimalInitBudget(), "construct-minimal");
            } catch (RuntimeException e) {
                log.error("Minimal construction could not be started", e);
                secondary = CompletableFuture.completedFuture(CallResult.failure(
                        ErrorInfo.of(ErrorKind.INIT_CONFIG_INVALID, String.valueOf(e.getMessage()))));
            }
            pendingConstruct = secondary;
            secondary.whenComplete((result, error) -> {
                if (error == null) {
                    onSecondaryResult(attempt, startedAt, minimal, result);
                }
            });
        }
    }

    private void onSecondaryResult(long attempt, long startedAt, CoreConfig minimal, CallResult<SystemHandle> result) {
        if (result.isSuccess()) {
            settleReady(attempt, startedAt, minimal, result.getValue());
            return;
        }
        ErrorInfo error = result.getError();
        if (error.getKind() == ErrorKind.CALL_TIMEOUT) {
            settleDegraded(attempt, startedAt, "initialization timed out with full and minimal configuration");
        } else {
            settleDegraded(attempt, startedAt, "minimal configuration failed: " + error.getMessage());
        }
    }

    private void settleReady(long attempt, long startedAt, CoreConfig config, SystemHandle newHandle) {
        CompletableFuture<LifecycleState> future;
        LifecycleState ready = LifecycleState.ready();
        synchronized (this) {
            if (attempt != generation) {
                future = null;
            } else {
                future = pendingInit;
                state = ready;
                handle = newHandle;
                activeConfig = config;
                pendingInit = null;
                pendingConstruct = null;
            }
        }
        if (future == null) {
            log.info("Discarding handle from a torn down initialization: {}", newHandle);
            destroyQuietly(newHandle);
            return;
        }
        Duration elapsed = elapsedSince(startedAt);
        log.info("Native core ready: handle={}, elapsed={}ms", newHandle, elapsed.toMillis());
        metricsService.recordInitialization("ready", elapsed);
        future.complete(ready);
    }

    private void settleDegraded(long attempt, long startedAt, String reason) {
        CompletableFuture<LifecycleState> future;
        LifecycleState degraded = LifecycleState.degraded(reason);
        synchronized (this) {
            if (attempt != generation) {
                return;
            }
            future = pendingInit;
            state = degraded;
            pendingInit = null;
            pendingConstruct = null;
        }
        Duration elapsed = elapsedSince(startedAt);
        log.warn("Native core degraded, serving fallback responses: reason={}", reason);
        metricsService.recordInitialization("degraded", elapsed);
        future.complete(degraded);
    }

    private void settleFailed(long attempt, long startedAt, RuntimeException cause) {
        CompletableFuture<LifecycleState> future;
        synchronized (this) {
            if (attempt != generation) {
                return;
            }
            future = pendingInit;
            state = LifecycleState.failed(cause.getMessage());
            pendingInit = null;
            pendingConstruct = null;
        }
        log.error("Native core initialization failed: {}", cause.getMessage());
        metricsService.recordInitialization("failed", elapsedSince(startedAt));
        future.completeExceptionally(cause);
    }

    // caller holds the monitor
    private void failNow(long attempt, long startedAt, RuntimeException cause) {
        state = LifecycleState.failed(cause.getMessage());
        pendingInit.completeExceptionally(cause);
        pendingInit = null;
        log.error("Native core initialization failed: attempt={}, reason={}", attempt, cause.getMessage());
        metricsService.recordInitialization("failed", elapsedSince(startedAt));
    }

    private void destroyQuietly(SystemHandle target) {
        try {
            boundary.destroy(target);
            log.info("Native core destroyed: handle={}", target);
        } catch (RuntimeException e) {
            log.error("Failed to destroy native core: handle={}", target, e);
        }
    }

    private static Duration elapsedSince(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }
}
