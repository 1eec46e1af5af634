package com.rizilab.averroes.bridge.controller;

import com.rizilab.averroes.bridge.domain.LifecycleState;
import com.rizilab.averroes.bridge.service.SystemLifecycle;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final SystemLifecycle lifecycle;

    public HealthController(SystemLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * The service stays healthy while degraded: fallback answers are still served.
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");

        LifecycleState state = lifecycle.state();
        response.put("core", state.getStatus().name().toLowerCase());
        response.put("mode", lifecycle.isReady() ? "native" : "fallback");

        return response;
    }
}
