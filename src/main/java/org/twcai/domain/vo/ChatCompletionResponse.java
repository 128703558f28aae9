package org.twcai.domain.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import org.twcai.domain.ChatMessage;
import org.twcai.domain.FinishReason;
import org.twcai.domain.Usage;

import java.util.List;

@Data
public class ChatCompletionResponse {
    private String id;
    private String object;
    private Long created;
    private String model;
    private List<Choice> choices;
    private Usage usage;

    @JsonProperty("system_fingerprint")
    private String systemFingerprint;

    @Data
    public static class Choice {
        private Integer index;
        private ChatMessage message;
        private JsonNode logprobs;

        @JsonProperty("finish_reason")
        private FinishReason finishReason;
    }
}
