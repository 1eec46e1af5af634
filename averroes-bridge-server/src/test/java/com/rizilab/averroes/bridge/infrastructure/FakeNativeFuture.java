package com.rizilab.averroes.bridge.infrastructure;

import com.rizilab.averroes.bridge.exception.NativeCallException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable native future that counts cancels and frees.
 */
public class FakeNativeFuture<T> implements NativeFuture<T> {

    private volatile boolean ready;
    private volatile T value;
    private volatile NativeCallException error;
    private volatile boolean polledAfterFree;

    private final AtomicInteger polls = new AtomicInteger();
    private final AtomicInteger cancels = new AtomicInteger();
    private final AtomicInteger frees = new AtomicInteger();

    public static <T> FakeNativeFuture<T> pending() {
        return new FakeNativeFuture<>();
    }

    public static <T> FakeNativeFuture<T> completed(T value) {
        FakeNativeFuture<T> future = new FakeNativeFuture<>();
        future.resolve(value);
        return future;
    }

    public static <T> FakeNativeFuture<T> failed(int code, String message) {
        FakeNativeFuture<T> future = new FakeNativeFuture<>();
        future.reject(code, message);
        return future;
    }

    public void resolve(T result) {
        value = result;
        ready = true;
    }

    public void reject(int code, String message) {
        error = new NativeCallException(code, message);
        ready = true;
    }

    @Override
    public NativePoll poll() {
        if (frees.get() > 0) {
            polledAfterFree = true;
        }
        polls.incrementAndGet();
        return ready ? NativePoll.READY : NativePoll.PENDING;
    }

    @Override
    public T complete() throws NativeCallException {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public void cancel() {
        cancels.incrementAndGet();
    }

    @Override
    public void free() {
        frees.incrementAndGet();
    }

    public int freeCount() {
        return frees.get();
    }

    public int cancelCount() {
        return cancels.get();
    }

    public boolean wasPolledAfterFree() {
        return polledAfterFree;
    }
}
