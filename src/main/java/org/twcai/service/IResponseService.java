package org.twcai.service;

import org.twcai.domain.dto.CreateResponseRequest;
import org.twcai.domain.dto.query.GetResponseQuery;
import org.twcai.domain.vo.Response;

public interface IResponseService {

    /**
     * POST /api/v1/cloud-ai/agents/{agentAccessId}/v1/responses
     */
    Response createResponse(String agentAccessId, CreateResponseRequest request);

    /**
     * GET /api/v1/cloud-ai/agents/{agentAccessId}/v1/responses/{responseId}
     */
    Response getResponse(String agentAccessId, String responseId, GetResponseQuery query);

    /**
     * DELETE /api/v1/cloud-ai/agents/{agentAccessId}/v1/responses/{responseId}; 204 counts as success.
     */
    void deleteResponse(String agentAccessId, String responseId);

    /**
     * POST /api/v1/cloud-ai/agents/{agentAccessId}/v1/responses/{responseId}/cancel
     *
     * <p>Only meaningful while the response is still running; the server decides whether it can be cancelled.</p>
     */
    Response cancelResponse(String agentAccessId, String responseId);
}
