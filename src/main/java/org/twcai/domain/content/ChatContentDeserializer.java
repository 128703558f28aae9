package org.twcai.domain.content;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.List;

/**
 * Picks the {@link ChatContent} variant from the JSON shape: a string is text, an array is parts.
 */
public class ChatContentDeserializer extends StdDeserializer<ChatContent> {

    public ChatContentDeserializer() {
        super(ChatContent.class);
    }

    @Override
    public ChatContent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return ChatContent.text(node.asText());
        }
        if (node.isArray()) {
            JavaType partsType = ctxt.getTypeFactory().constructCollectionType(List.class, ContentItem.class);
            List<ContentItem> items = ctxt.readTreeAsValue(node, partsType);
            if (items.contains(null)) {
                return ctxt.reportInputMismatch(this, "content parts must not contain null entries");
            }
            return ChatContent.parts(items);
        }
        return ctxt.reportInputMismatch(this,
                "content must be a string or an array of content parts, got %s", node.getNodeType());
    }
}
