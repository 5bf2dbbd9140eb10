package com.yamltest.service.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

final class ResponseBodies {

    private ResponseBodies() {
    }

    /** Parsed JSON when the payload is JSON, otherwise the text itself. */
    static JsonNode parse(ObjectMapper mapper, String payload) {
        if (payload == null || payload.isBlank()) {
            return TextNode.valueOf(payload == null ? "" : payload);
        }
        try {
            JsonNode node = mapper.readTree(payload);
            return node == null || node.isMissingNode() ? TextNode.valueOf(payload) : node;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(payload);
        }
    }

    /** Request body as sent on the wire: strings verbatim, structures as JSON. */
    static String serialize(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return null;
        }
        return body.isTextual() ? body.textValue() : body.toString();
    }
}
