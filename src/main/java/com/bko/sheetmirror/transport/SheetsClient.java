package com.bko.sheetmirror.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
public class SheetsClient {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    private final RequestExecutor executor;
    private final ErrorDecoder errorDecoder = new ErrorDecoder(new ObjectMapper());

    public SheetsClient(RequestExecutor executor) {
        this.executor = executor;
    }

    public JsonNode get(String path) throws IOException {
        return errorDecoder.decode(executor.get(path));
    }

    public <T> T get(String path, Class<T> type) throws IOException {
        return parse(executor.get(path), type);
    }

    public JsonNode post(String path, Object body) throws IOException {
        return errorDecoder.decode(executor.post(path, toJson(body)));
    }

    public <T> T post(String path, Object body, Class<T> type) throws IOException {
        return parse(executor.post(path, toJson(body)), type);
    }

    public String toJson(Object body) {
        try {
            return JSON_FACTORY.toString(body);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Request body cannot be serialized: " + e.getMessage(), e);
        }
    }

    private <T> T parse(byte[] body, Class<T> type) throws IOException {
        errorDecoder.decode(body);
        try {
            return JSON_FACTORY.fromString(new String(body, StandardCharsets.UTF_8), type);
        } catch (IOException | IllegalArgumentException e) {
            throw new DecodeException("Unexpected response shape for " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
