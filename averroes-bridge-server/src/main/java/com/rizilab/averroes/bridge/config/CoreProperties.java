package com.rizilab.averroes.bridge.config;

import com.rizilab.averroes.bridge.domain.CoreConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the native core and of the bridge around it ({@code averroes.core.*}).
 */
@Data
@ConfigurationProperties(prefix = "averroes.core")
public class CoreProperties {

    private String libraryName = "averroes_core";
    private boolean autoInitialize = true;

    private Map<String, String> apiKeys = new LinkedHashMap<>();
    private String preferredProvider = CoreConfig.MOCK_PROVIDER;
    private String modelName;
    private String vectorStoreUrl;
    private String chainRpcUrl;
    private boolean enableChainFeatures;
    private String storagePath;

    private Duration initTimeout = Duration.ofSeconds(15);
    private Duration minimalInitTimeout = Duration.ofSeconds(5);
    private boolean minimalRetryEnabled = true;
    private Duration callTimeout = Duration.ofSeconds(60);
    private Duration streamTimeout = Duration.ofSeconds(120);
    private Duration pollInterval = Duration.ofMillis(20);

    /**
     * Budget of the minimal-configuration retry, never more than half of {@code initTimeout}.
     */
    public Duration minimalInitBudget() {
        Duration half = initTimeout.dividedBy(2);
        return minimalInitTimeout.compareTo(half) < 0 ? minimalInitTimeout : half;
    }

    /**
     * Budget of the full-configuration attempt. With the minimal retry enabled both attempts
     * together fit in {@code initTimeout}.
     */
    public Duration primaryInitBudget() {
        return minimalRetryEnabled ? initTimeout.minus(minimalInitBudget()) : initTimeout;
    }

    public CoreConfig toCoreConfig() {
        return CoreConfig.builder()
                .apiKeys(apiKeys)
                .preferredProvider(preferredProvider)
                .modelName(modelName)
                .vectorStoreUrl(vectorStoreUrl)
                .chainRpcUrl(chainRpcUrl)
                .enableChainFeatures(enableChainFeatures)
                .storagePath(storagePath)
                .build();
    }
}
