package com.rizilab.averroes.bridge.controller;

import com.rizilab.averroes.bridge.domain.ErrorInfo;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

final class ErrorResponses {

    private ErrorResponses() {
    }

    static HttpStatus statusFor(ErrorInfo error) {
        switch (error.getKind()) {
            case INVALID_QUERY:
                return HttpStatus.BAD_REQUEST;
            case NATIVE_REPORTED:
            case PROTOCOL_VIOLATION:
                return HttpStatus.BAD_GATEWAY;
            case CALL_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case NOT_INITIALIZED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    static ResponseEntity<Object> of(ErrorInfo error) {
        return ResponseEntity.status(statusFor(error)).body(body(error));
    }

    static Map<String, Object> body(ErrorInfo error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.getKind().name());
        body.put("detail", error.getMessage());
        if (error.getCode() != ErrorInfo.NO_CODE) {
            body.put("code", error.getCode());
        }
        return body;
    }
}
