package org.twcai.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.twcai.domain.ConversationItemContent;
import org.twcai.domain.Role;

import java.util.List;

/**
 * Message item sent when creating a conversation or appending items to one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationItemInput {

    private String type = "message";

    private Role role;

    private List<ConversationItemContent> content;

    public ConversationItemInput(Role role, List<ConversationItemContent> content) {
        this.role = role;
        this.content = content;
    }

    public static ConversationItemInput message(Role role, String text) {
        return new ConversationItemInput(role, List.of(ConversationItemContent.inputText(text)));
    }
}
