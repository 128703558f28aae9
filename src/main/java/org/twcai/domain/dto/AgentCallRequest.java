package org.twcai.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentCallRequest {

    private String message;

    // continues the thread after this message
    @JsonProperty("parent_message_id")
    private String parentMessageId;

    @JsonProperty("file_ids")
    private List<String> fileIds;
}
