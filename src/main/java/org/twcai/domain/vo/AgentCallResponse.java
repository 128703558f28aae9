package org.twcai.domain.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Reply of the simple agent call endpoint.
 */
@Data
public class AgentCallResponse {
    private String message;

    private String id;

    @JsonProperty("response_id")
    private String responseId;

    @JsonProperty("finish_reason")
    private String finishReason;
}
