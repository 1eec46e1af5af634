package com.rizilab.averroes.bridge.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

/**
 * State of the native subsystem lifecycle. {@code reason} is set for FAILED and DEGRADED.
 */
@Getter
@ToString
@EqualsAndHashCode(exclude = "since")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LifecycleState {

    public enum Status {
        NOT_INITIALIZED,
        INITIALIZING,
        READY,
        DEGRADED,
        FAILED
    }

    private final Status status;
    private final String reason;
    private final Instant since;

    public static LifecycleState notInitialized() {
        return new LifecycleState(Status.NOT_INITIALIZED, null, Instant.now());
    }

    public static LifecycleState initializing() {
        return new LifecycleState(Status.INITIALIZING, null, Instant.now());
    }

    public static LifecycleState ready() {
        return new LifecycleState(Status.READY, null, Instant.now());
    }

    public static LifecycleState degraded(String reason) {
        return new LifecycleState(Status.DEGRADED, reason, Instant.now());
    }

    public static LifecycleState failed(String reason) {
        return new LifecycleState(Status.FAILED, reason, Instant.now());
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Ready, Degraded and Failed end an initialization attempt.
     */
    public boolean isSettled() {
        return status == Status.READY || status == Status.DEGRADED || status == Status.FAILED;
    }

    public boolean is(Status candidate) {
        return status == candidate;
    }
}
