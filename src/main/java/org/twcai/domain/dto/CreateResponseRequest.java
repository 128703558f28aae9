package org.twcai.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request body for creating a response. The agent's own configuration takes precedence over {@code model}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateResponseRequest {

    private String model;

    private String instructions;

    private ResponseInput input;

    @JsonProperty("max_output_tokens")
    private Integer maxOutputTokens;

    private Double temperature;

    private Map<String, Object> metadata;

    private JsonNode tools;

    private Boolean stream;

    @JsonProperty("stream_options")
    private JsonNode streamOptions;

    private Boolean background;

    private JsonNode text;

    @JsonProperty("tool_choice")
    private JsonNode toolChoice;

    @JsonProperty("parallel_tool_calls")
    private Boolean parallelToolCalls;

    @JsonProperty("max_tool_calls")
    private Integer maxToolCalls;

    @JsonProperty("previous_response_id")
    private String previousResponseId;

    private JsonNode conversation;

    private List<String> include;

    private Boolean store;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("top_logprobs")
    private Integer topLogprobs;

    private String truncation;

    @JsonProperty("service_tier")
    private String serviceTier;

    @JsonProperty("safety_identifier")
    private String safetyIdentifier;

    @JsonProperty("prompt_cache_key")
    private String promptCacheKey;

    private JsonNode prompt;

    private JsonNode reasoning;

    /**
     * @deprecated superseded by {@code safety_identifier} and {@code prompt_cache_key}
     */
    @Deprecated
    private String user;
}
