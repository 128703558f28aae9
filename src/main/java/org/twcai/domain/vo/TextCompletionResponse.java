package org.twcai.domain.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import org.twcai.domain.Usage;

import java.util.List;

/**
 * Legacy completion result; {@code object} is always {@code text_completion}.
 */
@Data
public class TextCompletionResponse {
    private String id;
    private String object;
    private Long created;
    private String model;
    private List<Choice> choices;
    private Usage usage;

    @Data
    public static class Choice {
        private String text;
        private Integer index;
        private Logprobs logprobs;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class Logprobs {
        private List<String> tokens;

        @JsonProperty("token_logprobs")
        private List<Double> tokenLogprobs;

        @JsonProperty("top_logprobs")
        private JsonNode topLogprobs;

        @JsonProperty("text_offset")
        private List<Integer> textOffset;
    }
}
