package org.twcai.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.Method;
import org.twcai.domain.dto.AgentCallRequest;
import org.twcai.domain.dto.ChatCompletionRequest;
import org.twcai.domain.dto.TextCompletionRequest;
import org.twcai.domain.vo.AgentCallResponse;
import org.twcai.domain.vo.ChatCompletionResponse;
import org.twcai.domain.vo.ModelsResponse;
import org.twcai.domain.vo.TextCompletionResponse;
import org.twcai.http.RequestDispatcher;
import org.twcai.service.IAgentService;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class AgentServiceImpl implements IAgentService {

    private final RequestDispatcher dispatcher;

    public AgentServiceImpl(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public AgentCallResponse callAgent(String agentAccessId, AgentCallRequest request) {
        return dispatcher.send(Method.POST, AgentPaths.agent(agentAccessId) + "/call", true, request, null,
                AgentCallResponse.class);
    }

    @Override
    public ChatCompletionResponse chatCompletions(String agentAccessId, ChatCompletionRequest request) {
        if (request != null && Boolean.TRUE.equals(request.getStream())) {
            log.debug("stream=true sent to agent {}; the reply is decoded as a single completion", agentAccessId);
        }
        return dispatcher.send(Method.POST, AgentPaths.agent(agentAccessId) + "/v1/chat/completions", true,
                request, null, ChatCompletionResponse.class);
    }

    @Override
    @Deprecated
    public TextCompletionResponse textCompletions(String agentAccessId, TextCompletionRequest request) {
        return dispatcher.send(Method.POST, AgentPaths.agent(agentAccessId) + "/v1/completions", true,
                request, null, TextCompletionResponse.class);
    }

    @Override
    public ModelsResponse listModels(String agentAccessId) {
        return dispatcher.send(Method.GET, AgentPaths.agent(agentAccessId) + "/v1/models", true, null, null,
                ModelsResponse.class);
    }

    @Override
    public String getEmbedCode(String agentAccessId, Boolean collapsed, String referer, String origin) {
        Map<String, Object> query = new LinkedHashMap<>();
        if (collapsed != null) {
            query.put("collapsed", collapsed);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (referer != null) {
            headers.put(HttpHeaders.REFERER, referer);
        }
        if (origin != null) {
            headers.put("Origin", origin);
        }
        return dispatcher.sendForText(Method.GET, AgentPaths.agent(agentAccessId) + "/embed.js", false, query,
                headers);
    }
}
