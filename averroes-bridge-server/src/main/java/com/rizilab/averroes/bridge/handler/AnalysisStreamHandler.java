package com.rizilab.averroes.bridge.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rizilab.averroes.bridge.controller.AnalyzeRequest;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.QueryKind;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import com.rizilab.averroes.bridge.infrastructure.StreamCallback;
import com.rizilab.averroes.bridge.service.MetricsService;
import com.rizilab.averroes.bridge.service.QueryFacade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams analyses over {@code /ws/analysis?session_id=...&user_id=...}.
 *
 * The session_id names the conversation: a new chat frame supersedes the stream still running
 * for it, and closing the socket cancels it.
 */
@Slf4j
@Component
public class AnalysisStreamHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final QueryFacade queryFacade;
    private final MetricsService metricsService;

    // wsSession id -> thread-safe view of the session
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public AnalysisStreamHandler(ObjectMapper objectMapper,
                                 QueryFacade queryFacade,
                                 MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.queryFacade = queryFacade;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) {
        sessions.put(wsSession.getId(),
                new ConcurrentWebSocketSessionDecorator(wsSession, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        metricsService.incrementGauge("websocket.connections.active");
        log.info("WebSocket connected: wsId={}, sessionId={}, userId={}",
                wsSession.getId(), extractSessionId(wsSession), extractUserId(wsSession));
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        WebSocketSession session = sessions.getOrDefault(wsSession.getId(), wsSession);
        String sessionId = extractSessionId(wsSession);
        String payload = message.getPayload();
        log.debug("Received frame from {}: {}", wsSession.getId(), payload);

        Map<String, Object> frame;
        try {
            frame = objectMapper.readValue(payload, Map.class);
        } catch (JsonProcessingException e) {
            if ("ping".equals(payload)) {
                send(session, Map.of("type", "pong"));
                return;
            }
            log.warn("Unreadable frame: wsId={}, error={}", wsSession.getId(), e.getOriginalMessage());
            sendError(session, ErrorInfo.invalidQuery("frame is not valid JSON"));
            return;
        }

        Object type = frame.get("type");
        switch (type != null ? type.toString() : "") {
            case "chat":
                handleChat(session, sessionId, extractUserId(wsSession), frame);
                break;
            case "cancel":
                boolean cancelled = queryFacade.cancelConversation(sessionId);
                log.info("Cancel requested: sessionId={}, active={}", sessionId, cancelled);
                break;
            case "ping":
                send(session, Map.of("type", "pong"));
                break;
            default:
                log.warn("Unknown message type: {}", type);
                sendError(session, ErrorInfo.invalidQuery("unknown message type: " + type));
        }
    }

    private void handleChat(WebSocketSession session, String sessionId, String userId, Map<String, Object> frame) {
        QueryRequest request;
        try {
            AnalyzeRequest body = objectMapper.convertValue(frame, AnalyzeRequest.class);
            body.setConversationId(sessionId);
            if (body.getUserId() == null) {
                body.setUserId(userId);
            }
            if (body.getKind() == null) {
                body.setKind(QueryKind.CHAT_MESSAGE);
            }
            request = body.toQueryRequest();
        } catch (IllegalArgumentException e) {
            log.warn("Rejected chat frame: sessionId={}, error={}", sessionId, e.getMessage());
            sendError(session, ErrorInfo.invalidQuery("malformed chat frame"));
            return;
        }
        queryFacade.analyzeStream(request, new WebSocketStreamCallback(session));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        String sessionId = extractSessionId(wsSession);
        log.info("WebSocket closed: wsId={}, sessionId={}, status={}", wsSession.getId(), sessionId, status);
        sessions.remove(wsSession.getId());
        metricsService.decrementGauge("websocket.connections.active");
        queryFacade.cancelConversation(sessionId);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}, sessionId={}",
                wsSession.getId(), extractSessionId(wsSession), exception);
        metricsService.incrementCounter("websocket.transport.errors");
    }

    private void send(WebSocketSession session, Map<String, Object> frame) {
        if (!session.isOpen()) {
            log.debug("Dropping frame for closed session: wsId={}", session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (IOException e) {
            log.error("Failed to send frame: wsId={}, type={}", session.getId(), frame.get("type"), e);
        }
    }

    private void sendError(WebSocketSession session, ErrorInfo error) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "error");
        frame.put("kind", error.getKind().name());
        frame.put("error", error.getMessage());
        if (error.getCode() != ErrorInfo.NO_CODE) {
            frame.put("code", error.getCode());
        }
        frame.put("timestamp", Instant.now().toString());
        send(session, frame);
    }

    /**
     * Expected format: /ws/analysis?session_id=xxx. Without one the socket is its own conversation.
     */
    private String extractSessionId(WebSocketSession session) {
        return queryParam(session, "session_id", session.getId());
    }

    private String extractUserId(WebSocketSession session) {
        return queryParam(session, "user_id", "default_user");
    }

    private static String queryParam(WebSocketSession session, String name, String defaultValue) {
        String query = session.getUri() != null ? session.getUri().getQuery() : null;
        if (query != null) {
            String prefix = name + "=";
            for (String param : query.split("&")) {
                if (param.startsWith(prefix)) {
                    return param.substring(prefix.length());
                }
            }
        }
        return defaultValue;
    }

    private class WebSocketStreamCallback implements StreamCallback {
        private final WebSocketSession session;

        WebSocketStreamCallback(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void onChunk(String accumulatedText) {
            send(session, Map.of("type", "chunk", "content", accumulatedText));
        }

        @Override
        public void onComplete(QueryResponse response) {
            send(session, Map.of("type", "complete", "data", response));
        }

        @Override
        public void onError(ErrorInfo error) {
            sendError(session, error);
        }
    }
}
