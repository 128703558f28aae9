package org.twcai.service;

import org.twcai.domain.dto.AgentCallRequest;
import org.twcai.domain.dto.ChatCompletionRequest;
import org.twcai.domain.dto.TextCompletionRequest;
import org.twcai.domain.vo.AgentCallResponse;
import org.twcai.domain.vo.ChatCompletionResponse;
import org.twcai.domain.vo.ModelsResponse;
import org.twcai.domain.vo.TextCompletionResponse;

/**
 * Agent-level endpoints: simple calls, completions, models and the widget embed script.
 */
public interface IAgentService {

    /**
     * POST /api/v1/cloud-ai/agents/{agentAccessId}/call
     */
    AgentCallResponse callAgent(String agentAccessId, AgentCallRequest request);

    /**
     * POST /api/v1/cloud-ai/agents/{agentAccessId}/v1/chat/completions
     */
    ChatCompletionResponse chatCompletions(String agentAccessId, ChatCompletionRequest request);

    /**
     * POST /api/v1/cloud-ai/agents/{agentAccessId}/v1/completions
     *
     * @deprecated legacy endpoint, use {@link #chatCompletions(String, ChatCompletionRequest)}
     */
    @Deprecated
    TextCompletionResponse textCompletions(String agentAccessId, TextCompletionRequest request);

    /**
     * GET /api/v1/cloud-ai/agents/{agentAccessId}/v1/models
     */
    ModelsResponse listModels(String agentAccessId);

    /**
     * GET /api/v1/cloud-ai/agents/{agentAccessId}/embed.js
     *
     * <p>Sent without the bearer credential; the server authorizes the widget by {@code referer} and
     * {@code origin} instead.</p>
     *
     * @param collapsed render the widget collapsed, {@code null} for the server default
     * @return the JavaScript source
     */
    String getEmbedCode(String agentAccessId, Boolean collapsed, String referer, String origin);
}
