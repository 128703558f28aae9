package org.twcai.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Method;
import org.twcai.domain.dto.CreateResponseRequest;
import org.twcai.domain.dto.query.GetResponseQuery;
import org.twcai.domain.vo.Response;
import org.twcai.http.RequestDispatcher;
import org.twcai.service.IResponseService;

@Slf4j
public class ResponseServiceImpl implements IResponseService {

    private final RequestDispatcher dispatcher;

    public ResponseServiceImpl(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Response createResponse(String agentAccessId, CreateResponseRequest request) {
        return dispatcher.send(Method.POST, AgentPaths.responses(agentAccessId), true, request, null,
                Response.class);
    }

    @Override
    public Response getResponse(String agentAccessId, String responseId, GetResponseQuery query) {
        return dispatcher.send(Method.GET, AgentPaths.response(agentAccessId, responseId), true, null, query,
                Response.class);
    }

    @Override
    public void deleteResponse(String agentAccessId, String responseId) {
        dispatcher.sendForNoContent(Method.DELETE, AgentPaths.response(agentAccessId, responseId), true);
    }

    @Override
    public Response cancelResponse(String agentAccessId, String responseId) {
        Response response = dispatcher.send(Method.POST, AgentPaths.response(agentAccessId, responseId) + "/cancel",
                true, null, null, Response.class);
        log.info("Cancel requested for response {}, status now {}", responseId, response.getStatus());
        return response;
    }
}
