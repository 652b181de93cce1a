package com.bko.sheetmirror.transport;

import java.io.IOException;

// Returns the raw body; error envelopes are left to ErrorDecoder.
public interface RequestExecutor {
    byte[] get(String path) throws IOException;

    byte[] post(String path, String jsonBody) throws IOException;
}
