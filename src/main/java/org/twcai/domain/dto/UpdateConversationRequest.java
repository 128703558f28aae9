package org.twcai.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Replaces the metadata of a conversation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateConversationRequest {

    private Map<String, Object> metadata;
}
