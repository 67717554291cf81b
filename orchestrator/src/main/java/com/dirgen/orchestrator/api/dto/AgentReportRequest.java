package com.dirgen.orchestrator.api.dto;

import com.dirgen.orchestrator.model.BroadcastMessage;
import com.dirgen.orchestrator.model.ProtocolException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Request body for POST /agent/{id}/report: a {source, type, data} envelope
 * forwarded to the run's subscriber.
 *
 * Fields are bound as raw JSON so a wrongly typed field is reported as a
 * protocol error instead of being coerced.
 */
public record AgentReportRequest(JsonNode source, JsonNode type, JsonNode data) {

    /**
     * @throws ProtocolException if source/type are not non-empty strings or data is not an object
     */
    public BroadcastMessage toMessage(ObjectMapper json) {
        String src = requireText(source, "source");
        String typ = requireText(type, "type");
        if (data == null || !data.isObject()) {
            throw new ProtocolException("Field 'data' must be a JSON object");
        }
        Map<String, Object> payload = json.convertValue(data, new TypeReference<Map<String, Object>>() {});
        return new BroadcastMessage(src, typ, payload);
    }

    private static String requireText(JsonNode node, String field) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ProtocolException("Field '" + field + "' must be a non-empty string");
        }
        return node.asText();
    }
}
