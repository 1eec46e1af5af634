package com.rizilab.averroes.bridge.infrastructure;

import com.rizilab.averroes.bridge.domain.SystemHandle;
import com.rizilab.averroes.bridge.exception.NativeCallException;
import com.rizilab.averroes.bridge.exception.NativeUnavailableException;

/**
 * The foreign core as seen from Java: construct, invoke, stream, destroy.
 *
 * Arguments and results cross the boundary as JSON strings.
 */
public interface NativeBoundary {

    /**
     * Loads the core and checks that it can be called.
     *
     * @throws NativeUnavailableException if the library is missing or does not link
     */
    void verifyLinked();

    NativeFuture<SystemHandle> construct(String configJson) throws NativeCallException;

    NativeFuture<String> invoke(SystemHandle handle, String operation, String argsJson) throws NativeCallException;

    NativeStreamRegistration invokeStreaming(SystemHandle handle,
                                             String operation,
                                             String argsJson,
                                             NativeStreamSink sink) throws NativeCallException;

    void destroy(SystemHandle handle);

    String agentInfo(SystemHandle handle);

    boolean usingRealAi(SystemHandle handle);
}
