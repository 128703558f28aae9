package org.twcai.domain.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Base64 audio clip with its encoding.
 */
@Getter
@ToString(exclude = "data")
@EqualsAndHashCode
public class InputAudio {

    private final String data;

    private final AudioFormat format;

    @JsonCreator
    public InputAudio(@JsonProperty(value = "data", required = true) String data,
                      @JsonProperty(value = "format", required = true) AudioFormat format) {
        this.data = Objects.requireNonNull(data, "input_audio.data");
        this.format = Objects.requireNonNull(format, "input_audio.format");
    }
}
