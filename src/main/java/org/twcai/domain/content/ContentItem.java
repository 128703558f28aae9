package org.twcai.domain.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * One part of a multimodal chat message.
 *
 * <p>The JSON field {@code type} selects the variant and is always written. Decoding fails when
 * {@code type} is missing or unknown, or when the variant's payload field is absent.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContentItem.TextPart.class, name = ContentItem.TEXT),
        @JsonSubTypes.Type(value = ContentItem.ImageUrlPart.class, name = ContentItem.IMAGE_URL),
        @JsonSubTypes.Type(value = ContentItem.InputAudioPart.class, name = ContentItem.INPUT_AUDIO),
        @JsonSubTypes.Type(value = ContentItem.FilePart.class, name = ContentItem.FILE),
        @JsonSubTypes.Type(value = ContentItem.RefusalPart.class, name = ContentItem.REFUSAL)
})
public abstract class ContentItem {

    public static final String TEXT = "text";
    public static final String IMAGE_URL = "image_url";
    public static final String INPUT_AUDIO = "input_audio";
    public static final String FILE = "file";
    public static final String REFUSAL = "refusal";

    private ContentItem() {
    }

    /**
     * Discriminant written as the {@code type} field.
     */
    public abstract String type();

    public static TextPart text(String text) {
        return new TextPart(text);
    }

    public static ImageUrlPart imageUrl(String url) {
        return new ImageUrlPart(new ImageUrl(url, null));
    }

    public static ImageUrlPart imageUrl(String url, ImageDetail detail) {
        return new ImageUrlPart(new ImageUrl(url, detail));
    }

    public static InputAudioPart inputAudio(String base64Data, AudioFormat format) {
        return new InputAudioPart(new InputAudio(base64Data, format));
    }

    public static FilePart file(JsonNode file) {
        return new FilePart(file);
    }

    public static RefusalPart refusal(String refusal) {
        return new RefusalPart(refusal);
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    @JsonTypeName(TEXT)
    public static final class TextPart extends ContentItem {

        private final String text;

        @JsonCreator
        public TextPart(@JsonProperty(value = "text", required = true) String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        @Override
        public String type() {
            return TEXT;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    @JsonTypeName(IMAGE_URL)
    public static final class ImageUrlPart extends ContentItem {

        @JsonProperty("image_url")
        private final ImageUrl imageUrl;

        @JsonCreator
        public ImageUrlPart(@JsonProperty(value = "image_url", required = true) ImageUrl imageUrl) {
            this.imageUrl = Objects.requireNonNull(imageUrl, "image_url");
        }

        @Override
        public String type() {
            return IMAGE_URL;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    @JsonTypeName(INPUT_AUDIO)
    public static final class InputAudioPart extends ContentItem {

        @JsonProperty("input_audio")
        private final InputAudio inputAudio;

        @JsonCreator
        public InputAudioPart(@JsonProperty(value = "input_audio", required = true) InputAudio inputAudio) {
            this.inputAudio = Objects.requireNonNull(inputAudio, "input_audio");
        }

        @Override
        public String type() {
            return INPUT_AUDIO;
        }
    }

    /**
     * File reference; the payload is passed through untouched.
     */
    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    @JsonTypeName(FILE)
    public static final class FilePart extends ContentItem {

        private final JsonNode file;

        @JsonCreator
        public FilePart(@JsonProperty(value = "file", required = true) JsonNode file) {
            if (file == null || file.isNull() || file.isMissingNode()) {
                throw new IllegalArgumentException("file must not be null");
            }
            this.file = file;
        }

        @Override
        public String type() {
            return FILE;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    @JsonTypeName(REFUSAL)
    public static final class RefusalPart extends ContentItem {

        private final String refusal;

        @JsonCreator
        public RefusalPart(@JsonProperty(value = "refusal", required = true) String refusal) {
            this.refusal = Objects.requireNonNull(refusal, "refusal");
        }

        @Override
        public String type() {
            return REFUSAL;
        }
    }
}
