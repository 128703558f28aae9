package org.twcai.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.net.URIBuilder;
import org.twcai.domain.exception.CloudAiException;

import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class UrlUtils {

    private static final TypeReference<LinkedHashMap<String, JsonNode>> QUERY_MAP = new TypeReference<>() {
    };

    private UrlUtils() {
    }

    /**
     * Percent-encodes an identifier as a single RFC 3986 path segment, so {@code /} becomes {@code %2F} and a
     * space {@code %20}.
     *
     * @throws CloudAiException of kind {@code INVALID_REQUEST} when the identifier is null or blank
     */
    public static String pathSegment(String name, String value) {
        if (value == null || value.isBlank()) {
            throw CloudAiException.invalidRequest(name + " must not be blank");
        }
        try {
            // builds "/<segment>"
            return new URIBuilder().setPathSegments(value).build().getRawPath().substring(1);
        } catch (URISyntaxException e) {
            throw CloudAiException.invalidRequest(name + " is not a valid path segment: " + e.getMessage());
        }
    }

    /**
     * Flattens a query object into name/value pairs.
     *
     * <p>Pairs follow the declared property order of the query type. Null values are dropped and every list
     * element becomes its own {@code name=value} pair.</p>
     */
    public static List<NameValuePair> toQueryParameters(ObjectMapper objectMapper, Object query) {
        if (query == null) {
            return Collections.emptyList();
        }
        Map<String, JsonNode> values = objectMapper.convertValue(query, QUERY_MAP);
        List<NameValuePair> parameters = new ArrayList<>();
        values.forEach((name, value) -> {
            if (value == null || value.isNull()) {
                return;
            }
            if (value.isArray()) {
                value.forEach(element -> parameters.add(new BasicNameValuePair(name, element.asText())));
            } else {
                parameters.add(new BasicNameValuePair(name, value.asText()));
            }
        });
        return parameters;
    }
}
