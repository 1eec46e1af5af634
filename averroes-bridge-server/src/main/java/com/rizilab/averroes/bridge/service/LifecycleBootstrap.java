package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.config.CoreProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the native core once the application is up and tears it down on shutdown.
 */
@Slf4j
@Component
public class LifecycleBootstrap {

    private final SystemLifecycle lifecycle;
    private final CoreProperties properties;

    public LifecycleBootstrap(SystemLifecycle lifecycle, CoreProperties properties) {
        this.lifecycle = lifecycle;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isAutoInitialize()) {
            log.info("Native core auto-initialization disabled, serving fallback until restarted");
            return;
        }
        lifecycle.initialize(properties.toCoreConfig())
                .whenComplete((state, error) -> {
                    if (error != null) {
                        log.error("Native core unavailable, serving fallback responses: {}", error.getMessage());
                    } else {
                        log.info("Native core lifecycle settled: status={}", state.getStatus());
                    }
                });
    }

    @PreDestroy
    public void shutdown() {
        lifecycle.teardown();
    }
}
