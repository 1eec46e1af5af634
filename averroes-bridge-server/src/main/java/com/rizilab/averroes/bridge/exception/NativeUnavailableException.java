package com.rizilab.averroes.bridge.exception;

import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.ErrorKind;

/**
 * The native library could not be loaded or linked. Fatal at startup, never retried.
 */
public class NativeUnavailableException extends BridgeException {

    public NativeUnavailableException(String message, Throwable cause) {
        super(ErrorInfo.of(ErrorKind.NATIVE_UNAVAILABLE, message), cause);
    }

    public NativeUnavailableException(String message) {
        super(ErrorInfo.of(ErrorKind.NATIVE_UNAVAILABLE, message));
    }
}
