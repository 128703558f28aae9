package org.twcai.domain.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@ToString
@EqualsAndHashCode
public class ImageUrl {

    private final String url;

    private final ImageDetail detail;

    @JsonCreator
    public ImageUrl(@JsonProperty(value = "url", required = true) String url,
                    @JsonProperty("detail") ImageDetail detail) {
        this.url = Objects.requireNonNull(url, "image_url.url");
        this.detail = detail;
    }
}
