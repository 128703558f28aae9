package org.twcai.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.twcai.domain.ChatMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion request. Unset fields are omitted from the payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionRequest {

    private String model;

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    private Integer n;

    // streaming chunks are not decoded by this client
    private Boolean stream;

    @JsonProperty("stream_options")
    private StreamOptions streamOptions;

    private List<String> stop;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("max_completion_tokens")
    private Integer maxCompletionTokens;

    @JsonProperty("presence_penalty")
    private Double presencePenalty;

    @JsonProperty("frequency_penalty")
    private Double frequencyPenalty;

    @JsonProperty("logit_bias")
    private Map<String, Integer> logitBias;

    private Boolean logprobs;

    @JsonProperty("top_logprobs")
    private Integer topLogprobs;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat;

    private List<ChatTool> tools;

    @JsonProperty("tool_choice")
    private JsonNode toolChoice;

    @JsonProperty("parallel_tool_calls")
    private Boolean parallelToolCalls;

    private Long seed;

    private String user;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StreamOptions {

        @JsonProperty("include_usage")
        private Boolean includeUsage;
    }
}
