package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.QueryKind;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultFallbackResponseGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final DefaultFallbackResponseGenerator generator =
            new DefaultFallbackResponseGenerator(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void bitcoinTokenRuling() {
        QueryResponse response = generator.generate(QueryRequest.token("btc"));

        assertTrue(response.getText().startsWith("HARAM"));
        assertTrue(response.getText().contains("Bitcoin"));
        assertEquals(List.of("fallback"), response.getSources());
        assertTrue(response.getConfidence() <= 0.7);
        assertTrue(response.isFallback());
        assertEquals(NOW, response.getCreatedAt());
        assertTrue(response.getId().startsWith("fallback-"));
    }

    @Test
    void everyKnownTokenStaysWithinConfidenceCap() {
        for (String symbol : List.of("BTC", "SOL", "USDC", "ETH", "DOGE")) {
            QueryResponse response = generator.generate(QueryRequest.token(symbol));
            assertTrue(response.getConfidence() <= FallbackResponseGenerator.MAX_CONFIDENCE, symbol);
            assertFalse(response.getFollowUps().isEmpty(), symbol);
        }
    }

    @Test
    void textIsDeterministic() {
        QueryResponse first = generator.generate(QueryRequest.text("Is riba allowed in DeFi lending?"));
        QueryResponse second = generator.generate(QueryRequest.text("Is riba allowed in DeFi lending?"));

        assertEquals(first.getText(), second.getText());
        assertTrue(first.getText().startsWith("Riba"));
    }

    @Test
    void topicKeywordsAreMatched() {
        assertTrue(generator.generate(QueryRequest.text("How much zakat on my coins?")).getText().startsWith("Zakat"));
        assertTrue(generator.generate(QueryRequest.text("Is STAKING ok?")).getText().startsWith("Staking"));
        assertTrue(generator.generate(QueryRequest.text("Can I buy an NFT?")).getText().startsWith("NFTs"));
    }

    @Test
    void tokenNamesInTextUseTokenRuling() {
        QueryResponse response = generator.generate(QueryRequest.text("What about Solana?"));

        assertTrue(response.getText().startsWith("HALAL"));
    }

    @Test
    void audioIsTranscribedBySize() {
        QueryResponse small = generator.generate(audio(500));
        QueryResponse medium = generator.generate(audio(3000));

        assertTrue(small.getText().contains("Bitcoin"));
        assertTrue(medium.getText().contains("Ethereum"));
        assertEquals("Please analyze this cryptocurrency from Sharia perspective",
                DefaultFallbackResponseGenerator.transcribe(20_000));
    }

    @Test
    void contractWithoutKeywordsGetsContractGuidance() {
        QueryResponse response = generator.generate(QueryRequest.builder()
                .kind(QueryKind.CONTRACT)
                .text("0xabc123")
                .build());

        assertTrue(response.getText().startsWith("A smart contract"));
    }

    private static QueryRequest audio(int size) {
        return QueryRequest.builder().kind(QueryKind.AUDIO).audio(new byte[size]).build();
    }
}
