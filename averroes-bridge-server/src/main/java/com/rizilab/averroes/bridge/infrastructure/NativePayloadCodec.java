package com.rizilab.averroes.bridge.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rizilab.averroes.bridge.domain.CallResult;
import com.rizilab.averroes.bridge.domain.CoreConfig;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import com.rizilab.averroes.bridge.model.NativeCoreConfig;
import com.rizilab.averroes.bridge.model.NativeQueryArgs;
import com.rizilab.averroes.bridge.model.NativeQueryResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Translates between bridge types and the JSON strings that cross the native boundary.
 */
@Slf4j
@Component
public class NativePayloadCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NativePayloadCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String encodeConfig(CoreConfig config) {
        NativeCoreConfig payload = NativeCoreConfig.builder()
                .apiKeys(config.getApiKeys())
                .preferredModel(config.getPreferredProvider())
                .modelName(config.getModelName())
                .qdrantUrl(config.getVectorStoreUrl())
                .solanaRpcUrl(config.getChainRpcUrl())
                .enableSolana(config.isEnableChainFeatures())
                .databasePath(config.isInMemoryStorage() ? "" : config.getStoragePath())
                .build();
        return write(payload);
    }

    public String encodeArgs(QueryRequest request) {
        NativeQueryArgs args = NativeQueryArgs.builder()
                .kind(request.getKind().name().toLowerCase())
                .text(request.getText())
                .audioBase64(request.audioLength() > 0
                        ? Base64.getEncoder().encodeToString(request.getAudio())
                        : null)
                .userId(request.getUserId())
                .language(request.getLanguage())
                .conversationId(request.getConversationId())
                .build();
        return write(args);
    }

    /**
     * Decodes a completion payload. A payload that cannot be read is a protocol violation.
     */
    public CallResult<QueryResponse> decodeResponse(String payload) {
        if (payload == null || payload.isBlank()) {
            return CallResult.failure(ErrorInfo.protocolViolation("empty completion payload"));
        }
        NativeQueryResponse raw;
        try {
            raw = objectMapper.readValue(payload, NativeQueryResponse.class);
        } catch (JsonProcessingException e) {
            log.error("Malformed completion payload from native core: {}", e.getOriginalMessage());
            return CallResult.failure(ErrorInfo.protocolViolation("malformed completion payload: " + e.getOriginalMessage()));
        }
        if (raw.getResponse() == null) {
            return CallResult.failure(ErrorInfo.protocolViolation("completion payload without response text"));
        }
        return CallResult.success(toResponse(raw));
    }

    private QueryResponse toResponse(NativeQueryResponse raw) {
        Instant createdAt = raw.getTimestamp() != null && raw.getTimestamp() > 0
                ? Instant.ofEpochSecond(raw.getTimestamp())
                : clock.instant();
        return QueryResponse.builder()
                .id(raw.getQueryId() != null ? raw.getQueryId() : "native-" + UUID.randomUUID())
                .text(raw.getResponse())
                .confidence(clamp(raw.getConfidence()))
                .sources(raw.getSources() != null ? raw.getSources() : List.of())
                .followUps(raw.getFollowUps() != null ? raw.getFollowUps() : List.of())
                .createdAt(createdAt)
                .analysisId(raw.getAnalysisId())
                .build();
    }

    private static double clamp(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode native payload " + value.getClass().getSimpleName(), e);
        }
    }
}
