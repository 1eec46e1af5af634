package com.rizilab.averroes.bridge.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rizilab.averroes.bridge.config.BridgeConfig;
import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.infrastructure.FakeNativeBoundary;
import com.rizilab.averroes.bridge.infrastructure.FakeNativeFuture;
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
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AnalysisControllerTest {

    private ScheduledExecutorService scheduler;
    private FakeNativeBoundary boundary;
    private CoreProperties properties;
    private SystemLifecycle lifecycle;
    private QueryFacade facade;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        boundary = new FakeNativeBoundary();
        properties = new CoreProperties();
        properties.setPollInterval(Duration.ofMillis(2));
        properties.setInitTimeout(Duration.ofSeconds(2));

        ObjectMapper objectMapper = new BridgeConfig().objectMapper();
        MetricsService metricsService = new MetricsService();
        Clock clock = Clock.systemUTC();
        NativePayloadCodec codec = new NativePayloadCodec(objectMapper, clock);
        NativeCallAdapter adapter = new NativeCallAdapter(boundary, scheduler, metricsService, properties);
        lifecycle = new SystemLifecycle(boundary, adapter, codec, new CoreConfigValidator(), metricsService, properties);
        facade = new QueryFacade(lifecycle, adapter, codec,
                new ConversationRegistry(30, metricsService),
                new FallbackStreamer(scheduler, metricsService, 1),
                metricsService, properties);
        ReflectionTestUtils.setField(facade, "fallbackGenerator", new DefaultFallbackResponseGenerator(clock));

        mockMvc = MockMvcBuilders
                .standaloneSetup(new AnalysisController(facade, lifecycle, properties), new HealthController(lifecycle))
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @AfterEach
    void tearDown() {
        lifecycle.teardown();
        scheduler.shutdownNow();
    }

    @Test
    void analyzeFallsBackWhenCoreIsNotInitialized() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"TOKEN\",\"text\":\"BTC\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sources[0]").value("fallback"))
                .andExpect(jsonPath("$.fallback").value(true));
    }

    @Test
    void emptyQueryIsBadRequest() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"TEXT\",\"text\":\"\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_QUERY"));
    }

    @Test
    void invalidAudioEncodingIsBadRequest() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"AUDIO\",\"audioBase64\":\"%%%\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingFallbackIsServiceUnavailable() throws Exception {
        ReflectionTestUtils.setField(facade, "fallbackGenerator", null);

        MvcResult pending = mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"TEXT\",\"text\":\"Is zakat due on stablecoins?\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("NOT_INITIALIZED"));
    }

    @Test
    void nativeTimeoutIsGatewayTimeout() throws Exception {
        restart();
        properties.setCallTimeout(Duration.ofMillis(20));
        boundary.onInvoke((operation, args) -> FakeNativeFuture.pending());

        MvcResult pending = mockMvc.perform(post("/api/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"TOKEN\",\"text\":\"SOL\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("CALL_TIMEOUT"));
    }

    @Test
    void statusAndRestart() throws Exception {
        mockMvc.perform(get("/api/system/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("NOT_INITIALIZED"))
                .andExpect(jsonPath("$.agent").value("Fallback"));

        restart();

        mockMvc.perform(get("/api/system/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ready").value(true))
                .andExpect(jsonPath("$.agent").value("Fake Agent"));
    }

    @Test
    void healthStaysUpWithoutCore() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.mode").value("fallback"));
    }

    private void restart() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/system/restart")).andReturn();
        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("READY"));
    }
}
