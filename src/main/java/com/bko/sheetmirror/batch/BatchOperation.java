package com.bko.sheetmirror.batch;

import com.google.api.services.sheets.v4.model.Request;

public interface BatchOperation {
    Request toRequest();
}
