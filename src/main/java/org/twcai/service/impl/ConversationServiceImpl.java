package org.twcai.service.impl;

import org.apache.hc.core5.http.Method;
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
import org.twcai.http.RequestDispatcher;
import org.twcai.service.IConversationService;

public class ConversationServiceImpl implements IConversationService {

    private final RequestDispatcher dispatcher;

    public ConversationServiceImpl(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Conversation createConversation(String agentAccessId, CreateConversationRequest request) {
        return dispatcher.send(Method.POST, AgentPaths.conversations(agentAccessId), true, request, null,
                Conversation.class);
    }

    @Override
    public Conversation getConversation(String agentAccessId, String conversationId) {
        return dispatcher.send(Method.GET, AgentPaths.conversation(agentAccessId, conversationId), true, null, null,
                Conversation.class);
    }

    @Override
    public Conversation updateConversation(String agentAccessId, String conversationId,
                                           UpdateConversationRequest request) {
        return dispatcher.send(Method.POST, AgentPaths.conversation(agentAccessId, conversationId), true, request,
                null, Conversation.class);
    }

    @Override
    public ConversationDeleted deleteConversation(String agentAccessId, String conversationId) {
        return dispatcher.send(Method.DELETE, AgentPaths.conversation(agentAccessId, conversationId), true, null,
                null, ConversationDeleted.class);
    }

    @Override
    public ConversationItemList listConversationItems(String agentAccessId, String conversationId,
                                                      ListItemsQuery query) {
        return dispatcher.send(Method.GET, AgentPaths.items(agentAccessId, conversationId), true, null, query,
                ConversationItemList.class);
    }

    @Override
    public ConversationItemList createConversationItems(String agentAccessId, String conversationId,
                                                        CreateItemsRequest request, CreateItemsQuery query) {
        return dispatcher.send(Method.POST, AgentPaths.items(agentAccessId, conversationId), true, request, query,
                ConversationItemList.class);
    }

    @Override
    public ConversationItem getConversationItem(String agentAccessId, String conversationId, String itemId,
                                                GetItemQuery query) {
        return dispatcher.send(Method.GET, AgentPaths.item(agentAccessId, conversationId, itemId), true, null,
                query, ConversationItem.class);
    }

    @Override
    public Conversation deleteConversationItem(String agentAccessId, String conversationId, String itemId) {
        return dispatcher.send(Method.DELETE, AgentPaths.item(agentAccessId, conversationId, itemId), true, null,
                null, Conversation.class);
    }
}
