package com.rizilab.averroes.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Construction parameters of the native core. An empty {@code database_path} selects the
 * in-memory store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NativeCoreConfig {

    @JsonProperty("api_keys")
    private Map<String, String> apiKeys;

    @JsonProperty("preferred_model")
    private String preferredModel;

    @JsonProperty("model_name")
    private String modelName;

    @JsonProperty("qdrant_url")
    private String qdrantUrl;

    @JsonProperty("solana_rpc_url")
    private String solanaRpcUrl;

    @JsonProperty("enable_solana")
    private boolean enableSolana;

    @JsonProperty("database_path")
    private String databasePath;
}
