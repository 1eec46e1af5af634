package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.CoreConfig;
import com.rizilab.averroes.bridge.domain.ValidationResult;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on a {@link CoreConfig} before it is handed to the native core.
 */
@Component
public class CoreConfigValidator {

    public ValidationResult validate(CoreConfig config) {
        List<String> errors = new ArrayList<>();

        String provider = config.getPreferredProvider();
        if (provider == null || provider.isBlank()) {
            errors.add("preferred provider is required");
        } else if (!CoreConfig.MOCK_PROVIDER.equals(provider) && config.apiKeyFor(provider).isEmpty()) {
            errors.add("no API key configured for provider '" + provider + "'");
        }

        if (config.isEnableChainFeatures()) {
            if (config.getChainRpcUrl() == null || config.getChainRpcUrl().isBlank()) {
                errors.add("chain features enabled without a chain RPC URL");
            } else if (!isHttpUrl(config.getChainRpcUrl())) {
                errors.add("chain RPC URL is not a valid http(s) URL: " + config.getChainRpcUrl());
            }
        }

        String vectorStoreUrl = config.getVectorStoreUrl();
        if (vectorStoreUrl != null && !vectorStoreUrl.isBlank() && !isHttpUrl(vectorStoreUrl)) {
            errors.add("vector store URL is not a valid http(s) URL: " + vectorStoreUrl);
        }

        return ValidationResult.of(errors);
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
