package com.rizilab.averroes.bridge.domain;

import lombok.Value;

/**
 * Describes why a call, stream or initialization did not produce an answer.
 *
 * {@code code} is the native error code for {@link ErrorKind#NATIVE_REPORTED}, -1 otherwise.
 */
@Value
public class ErrorInfo {

    public static final int NO_CODE = -1;

    ErrorKind kind;
    int code;
    String message;

    public static ErrorInfo of(ErrorKind kind, String message) {
        return new ErrorInfo(kind, NO_CODE, message);
    }

    public static ErrorInfo nativeReported(int code, String message) {
        return new ErrorInfo(ErrorKind.NATIVE_REPORTED, code, message);
    }

    public static ErrorInfo timeout(String operation, long timeoutMillis) {
        return of(ErrorKind.CALL_TIMEOUT, operation + " timed out after " + timeoutMillis + "ms");
    }

    public static ErrorInfo cancelled() {
        return of(ErrorKind.CALL_CANCELLED, "cancelled");
    }

    /**
     * The receiving side threw while a stream was being delivered to it; the stream is cancelled.
     */
    public static ErrorInfo deliveryFailed(RuntimeException cause) {
        return of(ErrorKind.CALL_CANCELLED, "delivery failed: " + cause.getMessage());
    }

    public static ErrorInfo protocolViolation(String message) {
        return of(ErrorKind.PROTOCOL_VIOLATION, message);
    }

    public static ErrorInfo invalidQuery(String message) {
        return of(ErrorKind.INVALID_QUERY, message);
    }
}
