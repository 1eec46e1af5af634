package com.rizilab.averroes.bridge.domain;

public enum ErrorKind {
    NATIVE_UNAVAILABLE,
    INIT_TIMEOUT,
    INIT_CONFIG_INVALID,
    CALL_TIMEOUT,
    CALL_CANCELLED,
    NATIVE_REPORTED,
    PROTOCOL_VIOLATION,
    NOT_INITIALIZED,
    INVALID_QUERY
}
