package org.twcai.service.impl;

import org.twcai.utils.UrlUtils;

/**
 * Path templates relative to the configured base URL. Identifiers are percent-encoded.
 */
final class AgentPaths {

    private static final String AGENTS = "/api/v1/cloud-ai/agents/";

    private AgentPaths() {
    }

    static String agent(String agentAccessId) {
        return AGENTS + UrlUtils.pathSegment("agentAccessId", agentAccessId);
    }

    static String conversations(String agentAccessId) {
        return agent(agentAccessId) + "/v1/conversations";
    }

    static String conversation(String agentAccessId, String conversationId) {
        return conversations(agentAccessId) + "/" + UrlUtils.pathSegment("conversationId", conversationId);
    }

    static String items(String agentAccessId, String conversationId) {
        return conversation(agentAccessId, conversationId) + "/items";
    }

    static String item(String agentAccessId, String conversationId, String itemId) {
        return items(agentAccessId, conversationId) + "/" + UrlUtils.pathSegment("itemId", itemId);
    }

    static String responses(String agentAccessId) {
        return agent(agentAccessId) + "/v1/responses";
    }

    static String response(String agentAccessId, String responseId) {
        return responses(agentAccessId) + "/" + UrlUtils.pathSegment("responseId", responseId);
    }
}
