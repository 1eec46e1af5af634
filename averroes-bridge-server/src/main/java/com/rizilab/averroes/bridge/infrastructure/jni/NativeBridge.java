package com.rizilab.averroes.bridge.infrastructure.jni;

import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.infrastructure.NativeStreamSink;

/**
 * JNI declarations for the {@code averroes_core} library.
 *
 * <p>Futures and handles are opaque pointers passed as {@code long}. Every future returned by
 * {@link #constructAsync} or {@link #invokeAsync} must be released with {@link #freeFuture}
 * exactly once. Callers go through {@link JniNativeBoundary} rather than this class.
 *
 * <pre>
 * abiVersion()     -> averroes_abi_version
 * constructAsync() -> averroes_system_new
 * invokeAsync()    -> averroes_system_invoke
 * pollFuture()     -> averroes_future_poll      (0 pending, 1 ready)
 * completeHandle() -> averroes_future_complete_handle
 * completeString() -> averroes_future_complete_string
 * cancelFuture()   -> averroes_future_cancel
 * freeFuture()     -> averroes_future_free
 * invokeStreaming()-> averroes_system_invoke_stream
 * cancelStream()   -> averroes_stream_cancel
 * destroy()        -> averroes_system_free
 * </pre>
 */
final class NativeBridge {

    static final int POLL_PENDING = 0;
    static final int POLL_READY = 1;

    private NativeBridge() {
    }

    static native int abiVersion();

    static native long constructAsync(String configJson) throws NativeCallException;

    static native long invokeAsync(long handle, String operation, String argsJson) throws NativeCallException;

    static native int pollFuture(long future);

    static native long completeHandle(long future) throws NativeCallException;

    static native String completeString(long future) throws NativeCallException;

    static native void cancelFuture(long future);

    static native void freeFuture(long future);

    static native long invokeStreaming(long handle,
                                       String operation,
                                       String argsJson,
                                       NativeStreamSink sink) throws NativeCallException;

    static native void cancelStream(long registration);

    static native void destroy(long handle);

    static native String agentInfo(long handle);

    static native boolean isUsingRealAi(long handle);
}
