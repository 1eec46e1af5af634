package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.CoreConfig;
import com.rizilab.averroes.bridge.domain.ValidationResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreConfigValidatorTest {

    private final CoreConfigValidator validator = new CoreConfigValidator();

    @Test
    void mockProviderNeedsNoKey() {
        CoreConfig config = CoreConfig.builder().preferredProvider(CoreConfig.MOCK_PROVIDER).build();

        assertTrue(validator.validate(config).isValid());
    }

    @Test
    void realProviderNeedsKey() {
        CoreConfig config = CoreConfig.builder().preferredProvider("openai").apiKey("groq", "g-123").build();

        ValidationResult result = validator.validate(config);

        assertFalse(result.isValid());
        assertEquals("no API key configured for provider 'openai'", result.getErrorMessage());
    }

    @Test
    void chainFeaturesNeedRpcUrl() {
        CoreConfig config = CoreConfig.builder()
                .preferredProvider(CoreConfig.MOCK_PROVIDER)
                .enableChainFeatures(true)
                .build();

        assertFalse(validator.validate(config).isValid());
    }

    @Test
    void collectsEveryViolation() {
        CoreConfig config = CoreConfig.builder()
                .preferredProvider(" ")
                .enableChainFeatures(true)
                .chainRpcUrl("not a url")
                .vectorStoreUrl("ftp://qdrant")
                .build();

        ValidationResult result = validator.validate(config);

        assertEquals(3, result.getErrors().size());
    }

    @Test
    void completeConfigIsValid() {
        CoreConfig config = CoreConfig.builder()
                .preferredProvider("openai")
                .apiKey("openai", "sk-test")
                .vectorStoreUrl("http://localhost:6333")
                .enableChainFeatures(true)
                .chainRpcUrl("https://api.devnet.solana.com")
                .build();

        assertTrue(validator.validate(config).isValid());
    }
}
