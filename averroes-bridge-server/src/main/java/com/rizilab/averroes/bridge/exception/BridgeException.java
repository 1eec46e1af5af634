package com.rizilab.averroes.bridge.exception;

import com.rizilab.averroes.bridge.domain.ErrorInfo;
import lombok.Getter;

/**
 * Base of the structural failures the bridge surfaces instead of recovering from.
 */
@Getter
public class BridgeException extends RuntimeException {

    private final ErrorInfo errorInfo;

    public BridgeException(ErrorInfo errorInfo) {
        super(errorInfo.getMessage());
        this.errorInfo = errorInfo;
    }

    public BridgeException(ErrorInfo errorInfo, Throwable cause) {
        super(errorInfo.getMessage(), cause);
        this.errorInfo = errorInfo;
    }
}
