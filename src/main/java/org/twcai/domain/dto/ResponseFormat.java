package org.twcai.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output format requested from the model: {@code text}, {@code json_object} or {@code json_schema}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResponseFormat {

    private String type;

    @JsonProperty("json_schema")
    private JsonNode jsonSchema;

    public static ResponseFormat text() {
        return new ResponseFormat("text", null);
    }

    public static ResponseFormat jsonObject() {
        return new ResponseFormat("json_object", null);
    }

    public static ResponseFormat jsonSchema(JsonNode schema) {
        return new ResponseFormat("json_schema", schema);
    }
}
