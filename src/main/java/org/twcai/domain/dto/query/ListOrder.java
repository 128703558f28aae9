package org.twcai.domain.dto.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ListOrder {

    ASC("asc"),
    DESC("desc");

    private final String value;

    ListOrder(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
