package org.twcai.domain.vo;

import lombok.Data;

@Data
public class ConversationDeleted {
    private String id;
    private String object;
    private boolean deleted;
}
