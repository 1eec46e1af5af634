package com.rizilab.averroes.bridge.infrastructure;

import com.rizilab.averroes.bridge.domain.SystemHandle;
import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.exception.NativeUnavailableException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link NativeBoundary} that records every future, stream and handle it hands out.
 */
public class FakeNativeBoundary implements NativeBoundary {

    @FunctionalInterface
    public interface ConstructBehaviour {
        FakeNativeFuture<SystemHandle> construct(String configJson) throws NativeCallException;
    }

    @FunctionalInterface
    public interface InvokeBehaviour {
        FakeNativeFuture<String> invoke(String operation, String argsJson) throws NativeCallException;
    }

    /**
     * One call to {@link #invokeStreaming}; tests drive the sink by hand.
     */
    public static class StreamInvocation {
        public final String operation;
        public final String argsJson;
        public final NativeStreamSink sink;
        private final AtomicBoolean cancelled = new AtomicBoolean();

        StreamInvocation(String operation, String argsJson, NativeStreamSink sink) {
            this.operation = operation;
            this.argsJson = argsJson;
            this.sink = sink;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }
    }

    private final AtomicLong nextHandle = new AtomicLong(0x1000);
    private final AtomicInteger linkAttempts = new AtomicInteger();

    private final List<String> constructConfigs = new CopyOnWriteArrayList<>();
    private final List<String> invokedOperations = new CopyOnWriteArrayList<>();
    private final List<FakeNativeFuture<?>> futures = new CopyOnWriteArrayList<>();
    private final List<StreamInvocation> streams = new CopyOnWriteArrayList<>();
    private final List<SystemHandle> destroyed = new CopyOnWriteArrayList<>();

    private volatile NativeUnavailableException linkFailure;
    private volatile ConstructBehaviour constructBehaviour = json -> FakeNativeFuture.completed(newHandle());
    private volatile InvokeBehaviour invokeBehaviour = (operation, args) -> FakeNativeFuture.pending();
    private volatile NativeCallException streamRejection;

    public SystemHandle newHandle() {
        return new SystemHandle(nextHandle.incrementAndGet());
    }

    public void failLinking(String message) {
        linkFailure = new NativeUnavailableException(message);
    }

    public void onConstruct(ConstructBehaviour behaviour) {
        constructBehaviour = behaviour;
    }

    public void onInvoke(InvokeBehaviour behaviour) {
        invokeBehaviour = behaviour;
    }

    public void rejectStreams(int code, String message) {
        streamRejection = new NativeCallException(code, message);
    }

    @Override
    public void verifyLinked() {
        linkAttempts.incrementAndGet();
        if (linkFailure != null) {
            throw linkFailure;
        }
    }

    @Override
    public NativeFuture<SystemHandle> construct(String configJson) throws NativeCallException {
        constructConfigs.add(configJson);
        FakeNativeFuture<SystemHandle> future = constructBehaviour.construct(configJson);
        futures.add(future);
        return future;
    }

    @Override
    public NativeFuture<String> invoke(SystemHandle handle, String operation, String argsJson) throws NativeCallException {
        invokedOperations.add(operation);
        FakeNativeFuture<String> future = invokeBehaviour.invoke(operation, argsJson);
        futures.add(future);
        return future;
    }

    @Override
    public NativeStreamRegistration invokeStreaming(SystemHandle handle,
                                                    String operation,
                                                    String argsJson,
                                                    NativeStreamSink sink) throws NativeCallException {
        invokedOperations.add(operation);
        if (streamRejection != null) {
            throw streamRejection;
        }
        StreamInvocation invocation = new StreamInvocation(operation, argsJson, sink);
        streams.add(invocation);
        return () -> invocation.cancelled.set(true);
    }

    @Override
    public void destroy(SystemHandle handle) {
        destroyed.add(handle);
    }

    @Override
    public String agentInfo(SystemHandle handle) {
        return "Fake Agent";
    }

    @Override
    public boolean usingRealAi(SystemHandle handle) {
        return false;
    }

    public int linkAttempts() {
        return linkAttempts.get();
    }

    public List<String> constructConfigs() {
        return constructConfigs;
    }

    public List<String> invokedOperations() {
        return invokedOperations;
    }

    public List<FakeNativeFuture<?>> futures() {
        return futures;
    }

    public List<StreamInvocation> streams() {
        return streams;
    }

    public StreamInvocation lastStream() {
        return streams.get(streams.size() - 1);
    }

    public List<SystemHandle> destroyed() {
        return destroyed;
    }
}
