package com.rizilab.averroes.bridge.exception;

import lombok.Getter;

/**
 * Error reported by the native core, thrown across the JNI boundary.
 *
 * Codes follow the core's error enum: 1 initialization, 2 AI backend, 3 invalid query.
 */
@Getter
public class NativeCallException extends Exception {

    public static final int INITIALIZATION_ERROR = 1;
    public static final int AI_ERROR = 2;
    public static final int INVALID_QUERY = 3;

    private final int code;

    public NativeCallException(int code, String message) {
        super(message);
        this.code = code;
    }

    public boolean isInitializationError() {
        return code == INITIALIZATION_ERROR;
    }
}
