package org.twcai.domain.vo;

import lombok.Data;
import org.twcai.domain.ConversationItemContent;

import java.util.List;

/**
 * Stored conversation message. Items are immutable; they can only be deleted.
 */
@Data
public class ConversationItem {
    private String type;
    private String id;
    private String status;
    private String role;
    private List<ConversationItemContent> content;
}
