package com.bko.sheetmirror.batch;

public class EmptyBatchException extends IllegalStateException {
    public EmptyBatchException(String message) {
        super(message);
    }
}
