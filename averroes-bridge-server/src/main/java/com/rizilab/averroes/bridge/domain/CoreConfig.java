package com.rizilab.averroes.bridge.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Configuration handed to the native core when it is constructed.
 */
@Value
@Builder(toBuilder = true)
public class CoreConfig {

    public static final String MOCK_PROVIDER = "mock";

    @Singular
    Map<String, String> apiKeys;
    String preferredProvider;
    String modelName;
    String vectorStoreUrl;
    String chainRpcUrl;
    boolean enableChainFeatures;
    String storagePath;

    /**
     * Same configuration with vector search and chain connectivity switched off.
     */
    public CoreConfig minimal() {
        return toBuilder()
                .vectorStoreUrl(null)
                .chainRpcUrl(null)
                .enableChainFeatures(false)
                .build();
    }

    public Optional<String> apiKeyFor(String provider) {
        return Optional.ofNullable(apiKeys.get(provider)).filter(key -> !key.isBlank());
    }

    public boolean isInMemoryStorage() {
        return storagePath == null || storagePath.isBlank();
    }

    public String chainNetworkName() {
        if (!enableChainFeatures || chainRpcUrl == null) {
            return "disabled";
        }
        return chainRpcUrl.contains("devnet") ? "Solana Devnet" : "Solana Mainnet";
    }
}
