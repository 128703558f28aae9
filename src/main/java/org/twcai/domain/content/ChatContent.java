package org.twcai.domain.content;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * Content of a chat message: either plain text or an ordered list of {@link ContentItem} parts.
 *
 * <p>On the wire the variant is carried by the JSON shape alone. Text is written as a bare string and
 * parts as an array, even when the array holds a single element.</p>
 */
@JsonSerialize(using = ChatContentSerializer.class)
@JsonDeserialize(using = ChatContentDeserializer.class)
public abstract class ChatContent {

    private ChatContent() {
    }

    public static ChatContent text(String text) {
        return new Text(text);
    }

    public static ChatContent parts(List<? extends ContentItem> items) {
        return new Parts(items);
    }

    public abstract boolean isText();

    /**
     * @throws IllegalStateException when this content holds parts
     */
    public abstract String asText();

    /**
     * @throws IllegalStateException when this content holds text
     */
    public abstract List<ContentItem> asParts();

    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Text extends ChatContent {

        private final String text;

        private Text(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean isText() {
            return true;
        }

        @Override
        public String asText() {
            return text;
        }

        @Override
        public List<ContentItem> asParts() {
            throw new IllegalStateException("Content is plain text");
        }
    }

    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Parts extends ChatContent {

        private final List<ContentItem> items;

        private Parts(List<? extends ContentItem> items) {
            this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        }

        @Override
        public boolean isText() {
            return false;
        }

        @Override
        public String asText() {
            throw new IllegalStateException("Content is a list of parts");
        }

        @Override
        public List<ContentItem> asParts() {
            return items;
        }
    }
}
