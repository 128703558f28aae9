package org.twcai.domain.content;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encodings accepted for base64 input audio.
 */
public enum AudioFormat {

    WAV("wav"),
    MP3("mp3"),
    M4A("m4a"),
    OGG("ogg"),
    FLAC("flac"),
    WEBM("webm");

    private final String value;

    AudioFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
