package org.twcai.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.twcai.domain.content.ChatContent;
import org.twcai.domain.content.ContentItem;

import java.util.List;

/**
 * A single chat turn: role plus content.
 */
@Data
@NoArgsConstructor
public class ChatMessage {

    private Role role;

    private ChatContent content;

    private String name;

    @JsonProperty("tool_call_id")
    private String toolCallId;

    @JsonProperty("tool_calls")
    private JsonNode toolCalls;

    public ChatMessage(Role role, ChatContent content) {
        this.role = role;
        this.content = content;
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(Role.SYSTEM, ChatContent.text(text));
    }

    public static ChatMessage developer(String text) {
        return new ChatMessage(Role.DEVELOPER, ChatContent.text(text));
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, ChatContent.text(text));
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage(Role.ASSISTANT, ChatContent.text(text));
    }

    /**
     * User message made of parts. Part count and order are passed through as given; limits are enforced
     * server-side.
     */
    public static ChatMessage userMultimodal(List<? extends ContentItem> items) {
        return new ChatMessage(Role.USER, ChatContent.parts(items));
    }
}
