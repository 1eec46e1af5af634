package com.rizilab.averroes.bridge.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable query created per call.
 *
 * Audio requests carry raw bytes, every other kind carries text.
 */
@Getter
@ToString(exclude = "audio")
@EqualsAndHashCode
public final class QueryRequest {

    public static final String DEFAULT_LANGUAGE = "en";

    private final QueryKind kind;
    private final String text;
    private final byte[] audio;
    private final String userId;
    private final String language;
    private final String conversationId;

    @Builder
    private QueryRequest(QueryKind kind,
                         String text,
                         byte[] audio,
                         String userId,
                         String language,
                         String conversationId) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
        this.audio = audio != null ? audio.clone() : null;
        this.userId = userId;
        this.language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
        this.conversationId = conversationId;
    }

    public static QueryRequest token(String symbol) {
        return QueryRequest.builder().kind(QueryKind.TOKEN).text(symbol).build();
    }

    public static QueryRequest text(String question) {
        return QueryRequest.builder().kind(QueryKind.TEXT).text(question).build();
    }

    public static QueryRequest chat(String conversationId, String message) {
        return QueryRequest.builder()
                .kind(QueryKind.CHAT_MESSAGE)
                .text(message)
                .conversationId(conversationId)
                .build();
    }

    public byte[] getAudio() {
        return audio != null ? audio.clone() : null;
    }

    public int audioLength() {
        return audio != null ? audio.length : 0;
    }

    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> conversationId() {
        return Optional.ofNullable(conversationId).filter(id -> !id.isBlank());
    }

    /**
     * True when the request has nothing to analyze.
     */
    public boolean isEmpty() {
        if (kind == QueryKind.AUDIO) {
            return audio == null || audio.length == 0;
        }
        return text == null || text.isBlank();
    }

    /**
     * Payload size in bytes, used for logging only.
     */
    public int payloadSize() {
        if (kind == QueryKind.AUDIO) {
            return audioLength();
        }
        return text != null ? text.getBytes(StandardCharsets.UTF_8).length : 0;
    }
}
