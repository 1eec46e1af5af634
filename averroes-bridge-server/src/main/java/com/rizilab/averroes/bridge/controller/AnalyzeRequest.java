package com.rizilab.averroes.bridge.controller;

import com.rizilab.averroes.bridge.domain.QueryKind;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Base64;

/**
 * JSON body of {@code POST /api/analyze} and of WebSocket chat frames.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

    private QueryKind kind;
    private String text;
    private String audioBase64;
    private String userId;
    private String language;
    private String conversationId;

    /**
     * @throws IllegalArgumentException if {@code audioBase64} is not valid Base64
     */
    public QueryRequest toQueryRequest() {
        return QueryRequest.builder()
                .kind(kind != null ? kind : QueryKind.TEXT)
                .text(text)
                .audio(audioBase64 != null ? Base64.getDecoder().decode(audioBase64) : null)
                .userId(userId)
                .language(language)
                .conversationId(conversationId)
                .build();
    }
}
