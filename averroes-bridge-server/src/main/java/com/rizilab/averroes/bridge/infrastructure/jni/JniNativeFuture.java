package com.rizilab.averroes.bridge.infrastructure.jni;

import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.infrastructure.NativeFuture;
import com.rizilab.averroes.bridge.infrastructure.NativePoll;

/**
 * Native future pointer plus the JNI call that reads its result.
 */
final class JniNativeFuture<T> implements NativeFuture<T> {

    @FunctionalInterface
    interface Completer<T> {
        T complete(long future) throws NativeCallException;
    }

    private final long pointer;
    private final Completer<T> completer;

    JniNativeFuture(long pointer, Completer<T> completer) {
        if (pointer == 0L) {
            throw new IllegalStateException("native core returned a null future");
        }
        this.pointer = pointer;
        this.completer = completer;
    }

    @Override
    public NativePoll poll() {
        return NativeBridge.pollFuture(pointer) == NativeBridge.POLL_READY ? NativePoll.READY : NativePoll.PENDING;
    }

    @Override
    public T complete() throws NativeCallException {
        return completer.complete(pointer);
    }

    @Override
    public void cancel() {
        NativeBridge.cancelFuture(pointer);
    }

    @Override
    public void free() {
        NativeBridge.freeFuture(pointer);
    }

    @Override
    public String toString() {
        return "JniNativeFuture[0x" + Long.toHexString(pointer) + "]";
    }
}
