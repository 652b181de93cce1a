package com.bko.sheetmirror.transport;

import com.bko.sheetmirror.shared.AppSettings;
import com.bko.sheetmirror.shared.GoogleSettings;
import com.bko.sheetmirror.shared.TransportSettings;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.client5.http.fluent.Response;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpRequestExecutorTest {
    private static final String BASE = "http://localhost:8089/v4";

    @Test
    void getSendsBearerTokenAndReturnsBody() throws Exception {
        Request request = stubbedRequest();
        Response response = mock(Response.class);
        when(request.execute()).thenReturn(response);
        when(response.handleResponse(any())).thenReturn("{\"ok\":true}".getBytes(StandardCharsets.UTF_8));

        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(BASE + "/spreadsheets/abc")).thenReturn(request);

            byte[] body = executor().get("/spreadsheets/abc");

            assertEquals("{\"ok\":true}", new String(body, StandardCharsets.UTF_8));
            verify(request).addHeader("Authorization", "Bearer token-1");
        }
    }

    @Test
    void postSendsJsonBody() throws Exception {
        Request request = stubbedRequest();
        Response response = mock(Response.class);
        when(request.bodyString(anyString(), any(ContentType.class))).thenReturn(request);
        when(request.execute()).thenReturn(response);
        when(response.handleResponse(any())).thenReturn("{}".getBytes(StandardCharsets.UTF_8));

        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.post(BASE + "/spreadsheets/abc:batchUpdate")).thenReturn(request);

            executor().post("/spreadsheets/abc:batchUpdate", "{\"requests\":[]}");

            verify(request).bodyString("{\"requests\":[]}", ContentType.APPLICATION_JSON);
        }
    }

    @Test
    void ioFailureBecomesTransportException() throws Exception {
        Request request = stubbedRequest();
        when(request.execute()).thenThrow(new SocketTimeoutException("Read timed out"));

        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(anyString())).thenReturn(request);

            TransportException e = assertThrows(TransportException.class, () -> executor().get("/spreadsheets/abc"));
            assertEquals(SocketTimeoutException.class, e.getCause().getClass());
        }
    }

    @Test
    void errorStatusWithBodyIsLeftToTheDecoder() throws Exception {
        ClassicHttpResponse response = mock(ClassicHttpResponse.class);
        when(response.getCode()).thenReturn(400);
        when(response.getEntity()).thenReturn(new StringEntity("{\"error\":{\"code\":400}}"));

        byte[] body = HttpRequestExecutor.readBody("POST", "/x", response);

        assertArrayEquals("{\"error\":{\"code\":400}}".getBytes(StandardCharsets.UTF_8), body);
    }

    @Test
    void errorStatusWithoutBodyIsTransportException() {
        ClassicHttpResponse response = mock(ClassicHttpResponse.class);
        when(response.getCode()).thenReturn(503);
        when(response.getEntity()).thenReturn(null);

        assertThrows(TransportException.class, () -> HttpRequestExecutor.readBody("GET", "/x", response));
    }

    private Request stubbedRequest() {
        Request request = mock(Request.class);
        when(request.addHeader(anyString(), anyString())).thenReturn(request);
        when(request.connectTimeout(any(Timeout.class))).thenReturn(request);
        when(request.responseTimeout(any(Timeout.class))).thenReturn(request);
        return request;
    }

    private HttpRequestExecutor executor() throws IOException {
        AccessTokenSource tokenSource = mock(AccessTokenSource.class);
        when(tokenSource.accessToken()).thenReturn("token-1");
        AppSettings settings = new AppSettings(
                new GoogleSettings("abc", "key.json", null),
                new TransportSettings(BASE, null, null));
        return new HttpRequestExecutor(settings, tokenSource);
    }
}
