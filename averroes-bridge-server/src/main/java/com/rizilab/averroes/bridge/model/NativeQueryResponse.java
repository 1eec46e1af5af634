package com.rizilab.averroes.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Completion payload as produced by the native core.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NativeQueryResponse {

    @JsonProperty("query_id")
    private String queryId;

    private String response;

    private Double confidence;

    private List<String> sources;

    @JsonProperty("follow_ups")
    private List<String> followUps;

    private Long timestamp; // epoch seconds

    @JsonProperty("analysis_id")
    private String analysisId;
}
