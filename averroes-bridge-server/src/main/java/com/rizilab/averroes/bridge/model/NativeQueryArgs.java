package com.rizilab.averroes.bridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NativeQueryArgs {

    private String kind;

    private String text;

    @JsonProperty("audio_base64")
    private String audioBase64;

    @JsonProperty("user_id")
    private String userId;

    private String language;

    @JsonProperty("conversation_id")
    private String conversationId;
}
