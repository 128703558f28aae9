package org.twcai.domain.vo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * Persisted conversation. Only its metadata can change after creation.
 */
@Data
public class Conversation {
    private String id;

    private String object;

    @JsonProperty("created_at")
    private Long createdAt;

    private Map<String, Object> metadata;
}
