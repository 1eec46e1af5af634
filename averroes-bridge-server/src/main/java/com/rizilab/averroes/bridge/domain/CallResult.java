package com.rizilab.averroes.bridge.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a native or fallback call: a value or an {@link ErrorInfo}, never both.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CallResult<T> {

    private final T value;
    private final ErrorInfo error;

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> CallResult<T> failure(ErrorInfo error) {
        return new CallResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <R> CallResult<R> flatMap(Function<? super T, CallResult<R>> mapper) {
        if (!isSuccess()) {
            return failure(error);
        }
        return mapper.apply(value);
    }
}
