package com.rizilab.averroes.bridge.exception;

import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.ErrorKind;

public class InitConfigInvalidException extends BridgeException {

    public InitConfigInvalidException(String message) {
        super(ErrorInfo.of(ErrorKind.INIT_CONFIG_INVALID, message));
    }

    public InitConfigInvalidException(String message, Throwable cause) {
        super(ErrorInfo.of(ErrorKind.INIT_CONFIG_INVALID, message), cause);
    }
}
