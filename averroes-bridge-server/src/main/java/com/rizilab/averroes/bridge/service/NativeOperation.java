package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.QueryKind;

/**
 * Operation names understood by the native core, per query kind.
 */
enum NativeOperation {
    TOKEN(QueryKind.TOKEN, "analyze_token"),
    TEXT(QueryKind.TEXT, "query"),
    CONTRACT(QueryKind.CONTRACT, "analyze_contract"),
    AUDIO(QueryKind.AUDIO, "analyze_audio"),
    CHAT_MESSAGE(QueryKind.CHAT_MESSAGE, "send_message");

    private static final String STREAM_SUFFIX = "_stream";

    private final QueryKind kind;
    private final String operation;

    NativeOperation(QueryKind kind, String operation) {
        this.kind = kind;
        this.operation = operation;
    }

    static NativeOperation forKind(QueryKind kind) {
        for (NativeOperation candidate : values()) {
            if (candidate.kind == kind) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("no native operation for " + kind);
    }

    String single() {
        return operation;
    }

    String streaming() {
        return operation + STREAM_SUFFIX;
    }
}
