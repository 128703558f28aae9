package org.twcai.service;

import org.twcai.domain.dto.CreateConversationRequest;
import org.twcai.domain.dto.CreateItemsRequest;
import org.twcai.domain.dto.UpdateConversationRequest;
import org.twcai.domain.dto.query.CreateItemsQuery;
import org.twcai.domain.dto.query.GetItemQuery;
import org.twcai.domain.dto.query.ListItemsQuery;
import org.twcai.domain.vo.Conversation;
import org.twcai.domain.vo.ConversationDeleted;
import org.twcai.domain.vo.ConversationItem;
import org.twcai.domain.vo.ConversationItemList;

/**
 * Conversations and their items under /api/v1/cloud-ai/agents/{agentAccessId}/v1/conversations.
 * Query arguments may be {@code null}.
 */
public interface IConversationService {

    Conversation createConversation(String agentAccessId, CreateConversationRequest request);

    Conversation getConversation(String agentAccessId, String conversationId);

    /**
     * Replaces the conversation metadata.
     */
    Conversation updateConversation(String agentAccessId, String conversationId, UpdateConversationRequest request);

    ConversationDeleted deleteConversation(String agentAccessId, String conversationId);

    /**
     * Returns one page; follow {@code last_id} while {@code has_more} is true.
     */
    ConversationItemList listConversationItems(String agentAccessId, String conversationId, ListItemsQuery query);

    ConversationItemList createConversationItems(String agentAccessId, String conversationId,
                                                 CreateItemsRequest request, CreateItemsQuery query);

    ConversationItem getConversationItem(String agentAccessId, String conversationId, String itemId,
                                         GetItemQuery query);

    /**
     * @return the conversation the item was removed from
     */
    Conversation deleteConversationItem(String agentAccessId, String conversationId, String itemId);
}
