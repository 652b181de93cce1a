package com.bko.sheetmirror.transport;

import java.io.IOException;

public interface AccessTokenSource {
    String accessToken() throws IOException;
}
