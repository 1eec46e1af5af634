package com.rizilab.averroes.bridge.infrastructure;

import com.rizilab.averroes.bridge.exception.NativeCallException;

/**
 * A pending native computation.
 *
 * The owner polls until {@link NativePoll#READY}, reads the outcome once with {@link #complete()},
 * and must call {@link #free()} exactly once whatever the outcome. {@link #cancel()} may precede
 * {@link #free()} when the result is no longer wanted.
 */
public interface NativeFuture<T> {

    NativePoll poll();

    T complete() throws NativeCallException;

    void cancel();

    void free();
}
