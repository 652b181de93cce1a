package com.bko.sheetmirror.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Reads a raw response body and turns an embedded {@code error} object into a
 * {@link RemoteApiException}. The envelope is authoritative: the HTTP status is not consulted.
 */
public class ErrorDecoder {
    private final ObjectMapper objectMapper;

    public ErrorDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode decode(byte[] body) throws IOException {
        if (body == null || body.length == 0) {
            throw new DecodeException("Empty response body");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed JSON response: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new DecodeException("Empty response body");
        }
        JsonNode error = node.get("error");
        if (error != null && error.isObject()) {
            throw new RemoteApiException(
                    error.path("code").asInt(),
                    error.path("status").asText(""),
                    error.path("message").asText(""));
        }
        return node;
    }
}
