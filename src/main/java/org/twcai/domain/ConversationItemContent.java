package org.twcai.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text-only content block used by conversation items, e.g. {@code input_text} or {@code output_text}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationItemContent {

    public static final String INPUT_TEXT = "input_text";
    public static final String OUTPUT_TEXT = "output_text";

    private String type;

    private String text;

    public static ConversationItemContent inputText(String text) {
        return new ConversationItemContent(INPUT_TEXT, text);
    }
}
