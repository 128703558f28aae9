package org.twcai.domain.content;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/**
 * Writes text content as a bare string and parts as an array of tagged items.
 */
public class ChatContentSerializer extends StdSerializer<ChatContent> {

    public ChatContentSerializer() {
        super(ChatContent.class);
    }

    @Override
    public void serialize(ChatContent value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value.isText()) {
            gen.writeString(value.asText());
            return;
        }
        // element type must be ContentItem so every part carries its "type" tag
        JavaType partsType = provider.getTypeFactory().constructCollectionType(List.class, ContentItem.class);
        provider.findValueSerializer(partsType).serialize(value.asParts(), gen, provider);
    }
}
