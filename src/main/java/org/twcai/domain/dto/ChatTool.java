package org.twcai.domain.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tool offered to the model. Function and custom definitions are opaque JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatTool {

    private String type;

    private JsonNode function;

    private JsonNode custom;

    public static ChatTool function(JsonNode definition) {
        return new ChatTool("function", definition, null);
    }

    public static ChatTool custom(JsonNode definition) {
        return new ChatTool("custom", null, definition);
    }
}
