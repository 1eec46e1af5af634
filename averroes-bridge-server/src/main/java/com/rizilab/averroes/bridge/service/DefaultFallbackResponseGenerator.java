package com.rizilab.averroes.bridge.service;

import com.rizilab.averroes.bridge.domain.QueryKind;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Canned rulings for well known tokens and keyword topics.
 *
 * Output depends only on the request, apart from the response id and timestamp.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "averroes.fallback.enabled", havingValue = "true", matchIfMissing = true)
public class DefaultFallbackResponseGenerator implements FallbackResponseGenerator {

    static final double TOKEN_CONFIDENCE = 0.7;
    static final double TOPIC_CONFIDENCE = 0.6;
    static final double GENERIC_CONFIDENCE = 0.5;

    private static final String OFFLINE_NOTE =
            " This is a general answer prepared while the full analysis engine is unavailable.";

    private static final Map<String, Ruling> TOKEN_RULINGS = new LinkedHashMap<>();
    private static final Map<String, String> TOKEN_NAMES = new LinkedHashMap<>();
    private static final Map<String, Ruling> TOPIC_RULINGS = new LinkedHashMap<>();

    static {
        TOKEN_RULINGS.put("BTC", new Ruling(
                "HARAM (disputed) - Bitcoin's extreme volatility and speculative use constitute excessive "
                        + "gharar (uncertainty), and it is widely traded for gambling-like speculation. "
                        + "Several scholars, including the Grand Mufti of Egypt, have ruled against it.",
                0.7,
                List.of("Which cryptocurrencies are considered halal?",
                        "What makes speculation haram?")));
        TOKEN_RULINGS.put("SOL", new Ruling(
                "HALAL - Solana is primarily a utility token for blockchain infrastructure. It does not "
                        + "involve riba (interest), excessive gharar (uncertainty) or maysir (gambling).",
                0.7,
                List.of("Is staking SOL permissible?",
                        "How is a utility token different from a security?")));
        TOKEN_RULINGS.put("USDC", new Ruling(
                "GENERALLY PERMISSIBLE - USDC is a fully collateralized US dollar stablecoin. Holding it "
                        + "is similar to holding currency; avoid interest-bearing lending products built on it.",
                0.65,
                List.of("Is earning yield on stablecoins riba?",
                        "Are fiat-backed stablecoins halal?")));
        TOKEN_RULINGS.put("ETH", new Ruling(
                "DISPUTED - Ethereum is a utility token for a smart contract platform. The asset itself is "
                        + "widely considered permissible, but many applications built on it involve riba or maysir.",
                0.6,
                List.of("Is proof-of-stake staking permissible?",
                        "How should DeFi protocols be screened?")));

        TOKEN_NAMES.put("bitcoin", "BTC");
        TOKEN_NAMES.put("solana", "SOL");
        TOKEN_NAMES.put("usd coin", "USDC");
        TOKEN_NAMES.put("ethereum", "ETH");

        TOPIC_RULINGS.put("riba", new Ruling(
                "Riba (interest) is prohibited in Islamic finance. Lending protocols that pay or charge a fixed "
                        + "return on borrowed assets are generally impermissible.",
                TOPIC_CONFIDENCE,
                List.of("What are halal alternatives to interest-bearing lending?")));
        TOPIC_RULINGS.put("interest", TOPIC_RULINGS.get("riba"));
        TOPIC_RULINGS.put("gharar", new Ruling(
                "Gharar (excessive uncertainty) invalidates a contract. Highly speculative trading, such as "
                        + "leveraged derivatives, falls under this prohibition.",
                TOPIC_CONFIDENCE,
                List.of("Is spot trading of cryptocurrency permissible?")));
        TOPIC_RULINGS.put("speculation", TOPIC_RULINGS.get("gharar"));
        TOPIC_RULINGS.put("gambling", new Ruling(
                "Maysir (gambling) is prohibited. Lotteries, casino tokens and prediction games that reward "
                        + "chance rather than effort or value are impermissible.",
                TOPIC_CONFIDENCE,
                List.of("Are play-to-earn games permissible?")));
        TOPIC_RULINGS.put("staking", new Ruling(
                "Staking may be permissible when rewards come from validating transactions (a service) rather "
                        + "than from lending. Liquid staking and lending-based yields need closer review.",
                TOPIC_CONFIDENCE,
                List.of("Is liquid staking permissible?")));
        TOPIC_RULINGS.put("zakat", new Ruling(
                "Zakat is due on cryptocurrency held as wealth for a full lunar year above the nisab threshold, "
                        + "generally at 2.5% of its market value.",
                TOPIC_CONFIDENCE,
                List.of("How is the nisab threshold calculated?")));
        TOPIC_RULINGS.put("sukuk", new Ruling(
                "Sukuk are Sharia-compliant certificates representing ownership in tangible assets. Tokenized "
                        + "sukuk can be permissible when the underlying asset and structure are compliant.",
                TOPIC_CONFIDENCE,
                List.of("How do sukuk differ from conventional bonds?")));
        TOPIC_RULINGS.put("nft", new Ruling(
                "NFTs are permissible when the underlying content is permissible and the sale is not driven by "
                        + "gambling mechanics such as random loot boxes.",
                TOPIC_CONFIDENCE,
                List.of("Are NFT mints with random traits permissible?")));
        TOPIC_RULINGS.put("contract", new Ruling(
                "A smart contract must be reviewed for riba, gharar and maysir. Contracts that only transfer "
                        + "ownership or provide a clear service are generally permissible.",
                TOPIC_CONFIDENCE,
                List.of("What should a Sharia audit of a smart contract check?")));
    }

    private final Clock clock;

    public DefaultFallbackResponseGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public QueryResponse generate(QueryRequest request) {
        String question = request.getKind() == QueryKind.AUDIO
                ? transcribe(request.audioLength())
                : Optional.ofNullable(request.getText()).orElse("").trim();

        Ruling ruling = request.getKind() == QueryKind.TOKEN
                ? tokenRuling(question.toUpperCase(Locale.ROOT))
                : textRuling(question, request.getKind() == QueryKind.CONTRACT);

        log.debug("Fallback answer generated: kind={}, payloadSize={}", request.getKind(), request.payloadSize());
        return QueryResponse.builder()
                .id("fallback-" + UUID.randomUUID())
                .text(ruling.text + OFFLINE_NOTE)
                .confidence(Math.min(ruling.confidence, MAX_CONFIDENCE))
                .source(QueryResponse.FALLBACK_SOURCE)
                .followUps(ruling.followUps)
                .createdAt(clock.instant())
                .build();
    }

    /**
     * Stand-in speech recognition keyed on payload size.
     */
    static String transcribe(int audioBytes) {
        if (audioBytes <= 1000) {
            return "Is Bitcoin halal?";
        }
        if (audioBytes <= 5000) {
            return "What is the Islamic ruling on Ethereum?";
        }
        return "Please analyze this cryptocurrency from Sharia perspective";
    }

    private static Ruling tokenRuling(String symbol) {
        Ruling ruling = TOKEN_RULINGS.get(symbol);
        if (ruling != null) {
            return ruling;
        }
        return new Ruling(
                "No stored ruling for " + symbol + ". Review the token's utility, its issuer, and whether it "
                        + "involves riba, gharar or maysir before investing.",
                GENERIC_CONFIDENCE,
                List.of("What criteria make a token halal?"));
    }

    private static Ruling textRuling(String question, boolean contract) {
        String lower = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> name : TOKEN_NAMES.entrySet()) {
            if (lower.contains(name.getKey())) {
                return TOKEN_RULINGS.get(name.getValue());
            }
        }
        for (Map.Entry<String, Ruling> topic : TOPIC_RULINGS.entrySet()) {
            if (lower.contains(topic.getKey())) {
                return topic.getValue();
            }
        }
        if (contract) {
            return TOPIC_RULINGS.get("contract");
        }
        return new Ruling(
                "Islamic finance permits trade and investment that avoid riba (interest), gharar (excessive "
                        + "uncertainty) and maysir (gambling). Assess your question against these principles.",
                GENERIC_CONFIDENCE,
                List.of("Is Bitcoin halal?", "How is zakat calculated on crypto?"));
    }

    private static final class Ruling {
        private final String text;
        private final double confidence;
        private final List<String> followUps;

        private Ruling(String text, double confidence, List<String> followUps) {
            this.text = text;
            this.confidence = confidence;
            this.followUps = followUps;
        }
    }
}
