package org.twcai.domain.vo;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import org.twcai.domain.Usage;
import org.twcai.domain.exception.CloudAiException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored model response.
 *
 * <p>Only the common fields are modelled. Every other field the server sends is kept verbatim in
 * {@link #getExtra()} and written back flat when the object is serialized again.</p>
 */
@Data
public class Response {

    public static final String STATUS_CANCELLED = "cancelled";

    private String id;

    private String object;

    @JsonProperty("created_at")
    private Long createdAt;

    private String model;

    private String status;

    private Usage usage;

    private final Map<String, JsonNode> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String name, JsonNode value) {
        extra.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtra() {
        return extra;
    }

    /**
     * @return this response
     * @throws CloudAiException of kind {@code CANCELLED} when the server reports the response as cancelled
     */
    public Response ensureNotCancelled() {
        if (STATUS_CANCELLED.equals(status)) {
            throw CloudAiException.cancelled(id);
        }
        return this;
    }
}
