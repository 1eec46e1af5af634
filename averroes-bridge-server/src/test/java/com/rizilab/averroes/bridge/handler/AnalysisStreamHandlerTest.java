package com.rizilab.averroes.bridge.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rizilab.averroes.bridge.config.BridgeConfig;
import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.infrastructure.FakeNativeBoundary;
import com.rizilab.averroes.bridge.infrastructure.NativeCallAdapter;
import com.rizilab.averroes.bridge.infrastructure.NativePayloadCodec;
import com.rizilab.averroes.bridge.service.ConversationRegistry;
import com.rizilab.averroes.bridge.service.CoreConfigValidator;
import com.rizilab.averroes.bridge.service.DefaultFallbackResponseGenerator;
import com.rizilab.averroes.bridge.service.FallbackStreamer;
import com.rizilab.averroes.bridge.service.MetricsService;
import com.rizilab.averroes.bridge.service.QueryFacade;
import com.rizilab.averroes.bridge.service.SystemLifecycle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisStreamHandlerTest {

    private ScheduledExecutorService scheduler;
    private SystemLifecycle lifecycle;
    private MetricsService metricsService;
    private ObjectMapper objectMapper;
    private AnalysisStreamHandler handler;

    private WebSocketSession session;
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        scheduler = Executors.newScheduledThreadPool(2);
        FakeNativeBoundary boundary = new FakeNativeBoundary();
        CoreProperties properties = new CoreProperties();
        properties.setPollInterval(Duration.ofMillis(2));

        objectMapper = new BridgeConfig().objectMapper();
        metricsService = new MetricsService();
        Clock clock = Clock.systemUTC();
        NativePayloadCodec codec = new NativePayloadCodec(objectMapper, clock);
        NativeCallAdapter adapter = new NativeCallAdapter(boundary, scheduler, metricsService, properties);
        lifecycle = new SystemLifecycle(boundary, adapter, codec, new CoreConfigValidator(), metricsService, properties);
        QueryFacade facade = new QueryFacade(lifecycle, adapter, codec,
                new ConversationRegistry(30, metricsService),
                new FallbackStreamer(scheduler, metricsService, 5),
                metricsService, properties);
        ReflectionTestUtils.setField(facade, "fallbackGenerator", new DefaultFallbackResponseGenerator(clock));
        handler = new AnalysisStreamHandler(objectMapper, facade, metricsService);

        session = mockSession("ws-1", "ws://localhost/ws/analysis?session_id=s-42&user_id=u-7", sent);
        handler.afterConnectionEstablished(session);
    }

    private WebSocketSession mockSession(String id, String uri, List<JsonNode> frames) throws Exception {
        WebSocketSession mocked = mock(WebSocketSession.class);
        when(mocked.getId()).thenReturn(id);
        when(mocked.getUri()).thenReturn(URI.create(uri));
        when(mocked.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            TextMessage message = invocation.getArgument(0);
            frames.add(objectMapper.readTree(message.getPayload()));
            return null;
        }).when(mocked).sendMessage(any());
        return mocked;
    }

    @AfterEach
    void tearDown() {
        lifecycle.teardown();
        scheduler.shutdownNow();
    }

    @Test
    void pingIsAnsweredWithPong() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleTextMessage(session, new TextMessage("ping"));

        assertEquals(2, sent.size());
        sent.forEach(frame -> assertEquals("pong", frame.get("type").asText()));
    }

    @Test
    void chatFrameStreamsFallbackUntilComplete() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"chat\",\"text\":\"Is staking halal?\"}"));

        JsonNode complete = awaitFrame("complete");

        assertTrue(sent.stream().anyMatch(frame -> "chunk".equals(frame.get("type").asText())));
        String finalChunk = sent.stream()
                .filter(frame -> "chunk".equals(frame.get("type").asText()))
                .reduce((first, second) -> second)
                .map(frame -> frame.get("content").asText())
                .orElseThrow();
        assertEquals(complete.get("data").get("text").asText(), finalChunk);
    }

    @Test
    void cancelFrameEndsStreamWithCancelledError() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"chat\",\"text\":\"Is zakat due on tokens?\"}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"cancel\"}"));

        JsonNode error = awaitFrame("error");

        assertEquals("CALL_CANCELLED", error.get("kind").asText());
    }

    @Test
    void unknownFrameTypeIsRejected() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\"}"));

        assertEquals("error", sent.get(0).get("type").asText());
        assertEquals("INVALID_QUERY", sent.get(0).get("kind").asText());
    }

    @Test
    void closingTheSocketReleasesTheConnectionGauge() {
        assertEquals(1, metricsService.getGaugeValue("websocket.connections.active"));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertEquals(0, metricsService.getGaugeValue("websocket.connections.active"));
    }

    @Test
    void socketsWithoutSessionIdDoNotShareAConversation() throws Exception {
        List<JsonNode> framesA = new CopyOnWriteArrayList<>();
        WebSocketSession socketA = mockSession("ws-a", "ws://localhost/ws/analysis", framesA);
        WebSocketSession socketB = mockSession("ws-b", "ws://localhost/ws/analysis", new CopyOnWriteArrayList<>());
        handler.afterConnectionEstablished(socketA);
        handler.afterConnectionEstablished(socketB);

        handler.handleTextMessage(socketA, new TextMessage("{\"type\":\"chat\",\"text\":\"Is staking halal?\"}"));
        handler.handleTextMessage(socketB, new TextMessage("{\"type\":\"chat\",\"text\":\"Is zakat due?\"}"));
        handler.afterConnectionClosed(socketB, CloseStatus.NORMAL);

        awaitFrame(framesA, "complete");
        assertTrue(framesA.stream().noneMatch(frame -> "error".equals(frame.get("type").asText())));
    }

    private JsonNode awaitFrame(String type) throws InterruptedException {
        return awaitFrame(sent, type);
    }

    private JsonNode awaitFrame(List<JsonNode> frames, String type) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            for (JsonNode frame : frames) {
                if (type.equals(frame.get("type").asText())) {
                    return frame;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("no " + type + " frame within 5s, got " + frames);
    }
}
