package org.twcai.domain.content;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImageDetail {

    LOW("low"),
    HIGH("high"),
    AUTO("auto");

    private final String value;

    ImageDetail(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
