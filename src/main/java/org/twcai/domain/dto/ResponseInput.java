package org.twcai.domain.dto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Input of a response request: plain text or a list of message objects, written as a JSON string or array.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonSerialize(using = ResponseInput.Serializer.class)
@JsonDeserialize(using = ResponseInput.Deserializer.class)
public final class ResponseInput {

    private final String text;

    private final List<JsonNode> messages;

    private ResponseInput(String text, List<JsonNode> messages) {
        this.text = text;
        this.messages = messages;
    }

    public static ResponseInput text(String text) {
        return new ResponseInput(Objects.requireNonNull(text, "text"), null);
    }

    public static ResponseInput messages(List<JsonNode> messages) {
        return new ResponseInput(null, List.copyOf(Objects.requireNonNull(messages, "messages")));
    }

    public boolean isText() {
        return text != null;
    }

    public static class Serializer extends StdSerializer<ResponseInput> {

        public Serializer() {
            super(ResponseInput.class);
        }

        @Override
        public void serialize(ResponseInput value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value.isText()) {
                gen.writeString(value.getText());
                return;
            }
            gen.writeStartArray();
            for (JsonNode message : value.getMessages()) {
                gen.writeTree(message);
            }
            gen.writeEndArray();
        }
    }

    public static class Deserializer extends StdDeserializer<ResponseInput> {

        public Deserializer() {
            super(ResponseInput.class);
        }

        @Override
        public ResponseInput deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node.isTextual()) {
                return ResponseInput.text(node.asText());
            }
            if (node.isArray()) {
                List<JsonNode> messages = new ArrayList<>(node.size());
                node.forEach(messages::add);
                return ResponseInput.messages(messages);
            }
            return ctxt.reportInputMismatch(this, "input must be a string or an array, got %s", node.getNodeType());
        }
    }
}
