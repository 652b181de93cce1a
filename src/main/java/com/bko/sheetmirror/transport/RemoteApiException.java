package com.bko.sheetmirror.transport;

import java.io.IOException;

/**
 * Error envelope returned in a response body by the Sheets API:
 * {@code {"error": {"code": 400, "status": "INVALID_ARGUMENT", "message": "..."}}}.
 */
public class RemoteApiException extends IOException {
    private final int code;
    private final String status;
    private final String remoteMessage;

    public RemoteApiException(int code, String status, String remoteMessage) {
        super("error status: " + status + ", code: " + code + ", message: " + remoteMessage);
        this.code = code;
        this.status = status;
        this.remoteMessage = remoteMessage;
    }

    public int getCode() {
        return code;
    }

    public String getStatus() {
        return status;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }
}
