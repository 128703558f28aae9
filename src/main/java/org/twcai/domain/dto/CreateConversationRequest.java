package org.twcai.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {

    /**
     * Initial items; the server accepts up to 20.
     */
    private List<ConversationItemInput> items;

    /**
     * Up to 16 key-value pairs, checked server-side only.
     */
    private Map<String, Object> metadata;
}
