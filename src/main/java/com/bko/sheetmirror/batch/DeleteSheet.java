package com.bko.sheetmirror.batch;

import com.google.api.services.sheets.v4.model.DeleteSheetRequest;
import com.google.api.services.sheets.v4.model.Request;

public record DeleteSheet(int sheetId) implements BatchOperation {
    @Override
    public Request toRequest() {
        return new Request().setDeleteSheet(new DeleteSheetRequest().setSheetId(sheetId));
    }
}
