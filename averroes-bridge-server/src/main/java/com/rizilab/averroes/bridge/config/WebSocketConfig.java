package com.rizilab.averroes.bridge.config;

import com.rizilab.averroes.bridge.handler.AnalysisStreamHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AnalysisStreamHandler analysisStreamHandler;

    public WebSocketConfig(AnalysisStreamHandler analysisStreamHandler) {
        this.analysisStreamHandler = analysisStreamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(analysisStreamHandler, "/ws/analysis")
                .setAllowedOrigins("*"); // In production, specify exact origins
    }
}
