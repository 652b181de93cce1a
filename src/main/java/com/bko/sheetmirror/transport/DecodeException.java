package com.bko.sheetmirror.transport;

import java.io.IOException;

public class DecodeException extends IOException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
