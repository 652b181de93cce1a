package com.bko.sheetmirror.transport;

import com.bko.sheetmirror.shared.AppSettings;
import com.bko.sheetmirror.shared.TransportSettings;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class HttpRequestExecutor implements RequestExecutor {
    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private final TransportSettings transport;
    private final AccessTokenSource tokenSource;

    public HttpRequestExecutor(AppSettings settings, AccessTokenSource tokenSource) {
        this.transport = settings.transport() != null ? settings.transport() : TransportSettings.defaults();
        this.tokenSource = tokenSource;
    }

    @Override
    public byte[] get(String path) throws IOException {
        logger.debug("GET {}", path);
        Request request = authorize(Request.get(transport.baseUrl() + path));
        return execute("GET", path, request);
    }

    @Override
    public byte[] post(String path, String jsonBody) throws IOException {
        logger.debug("POST {}", path);
        Request request = authorize(Request.post(transport.baseUrl() + path))
                .bodyString(jsonBody, ContentType.APPLICATION_JSON);
        return execute("POST", path, request);
    }

    private Request authorize(Request request) throws IOException {
        return request
                .addHeader("Authorization", "Bearer " + tokenSource.accessToken())
                .addHeader("Accept", "application/json")
                .connectTimeout(Timeout.of(transport.connectTimeout()))
                .responseTimeout(Timeout.of(transport.responseTimeout()));
    }

    private byte[] execute(String method, String path, Request request) throws IOException {
        try {
            return request.execute().handleResponse(response -> readBody(method, path, response));
        } catch (TransportException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException(method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    static byte[] readBody(String method, String path, ClassicHttpResponse response) throws IOException {
        HttpEntity entity = response.getEntity();
        byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
        int status = response.getCode();
        if (status >= 400) {
            if (body.length == 0) {
                throw new TransportException(method + " " + path + " failed: HTTP " + status);
            }
            logger.warn("{} {} returned HTTP {}", method, path, status);
        }
        return body;
    }
}
