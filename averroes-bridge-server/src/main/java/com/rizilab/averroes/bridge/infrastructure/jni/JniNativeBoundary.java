package com.rizilab.averroes.bridge.infrastructure.jni;

import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.domain.SystemHandle;
import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.exception.NativeUnavailableException;
import com.rizilab.averroes.bridge.infrastructure.NativeBoundary;
import com.rizilab.averroes.bridge.infrastructure.NativeFuture;
import com.rizilab.averroes.bridge.infrastructure.NativeStreamRegistration;
import com.rizilab.averroes.bridge.infrastructure.NativeStreamSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link NativeBoundary} backed by the {@code averroes_core} shared library.
 */
@Slf4j
@Component
public class JniNativeBoundary implements NativeBoundary {

    static final int SUPPORTED_ABI_VERSION = 1;

    private final String libraryName;
    private volatile boolean linked;

    public JniNativeBoundary(CoreProperties properties) {
        this.libraryName = properties.getLibraryName();
    }

    @Override
    public synchronized void verifyLinked() {
        if (linked) {
            return;
        }
        try {
            System.loadLibrary(libraryName);
            int abi = NativeBridge.abiVersion();
            if (abi != SUPPORTED_ABI_VERSION) {
                throw new NativeUnavailableException(
                        "native core " + libraryName + " has ABI " + abi + ", expected " + SUPPORTED_ABI_VERSION);
            }
            linked = true;
            log.info("Native core linked: library={}, abi={}", libraryName, abi);
        } catch (UnsatisfiedLinkError | SecurityException e) {
            throw new NativeUnavailableException("cannot load native core '" + libraryName + "': " + e.getMessage(), e);
        }
    }

    @Override
    public NativeFuture<SystemHandle> construct(String configJson) throws NativeCallException {
        long future = NativeBridge.constructAsync(configJson);
        return new JniNativeFuture<>(future, pointer -> new SystemHandle(NativeBridge.completeHandle(pointer)));
    }

    @Override
    public NativeFuture<String> invoke(SystemHandle handle, String operation, String argsJson) throws NativeCallException {
        long future = NativeBridge.invokeAsync(handle.pointer(), operation, argsJson);
        return new JniNativeFuture<>(future, NativeBridge::completeString);
    }

    @Override
    public NativeStreamRegistration invokeStreaming(SystemHandle handle,
                                                    String operation,
                                                    String argsJson,
                                                    NativeStreamSink sink) throws NativeCallException {
        long registration = NativeBridge.invokeStreaming(handle.pointer(), operation, argsJson, sink);
        return () -> NativeBridge.cancelStream(registration);
    }

    @Override
    public void destroy(SystemHandle handle) {
        NativeBridge.destroy(handle.pointer());
        log.info("Native core destroyed: {}", handle);
    }

    @Override
    public String agentInfo(SystemHandle handle) {
        return NativeBridge.agentInfo(handle.pointer());
    }

    @Override
    public boolean usingRealAi(SystemHandle handle) {
        return NativeBridge.isUsingRealAi(handle.pointer());
    }
}
