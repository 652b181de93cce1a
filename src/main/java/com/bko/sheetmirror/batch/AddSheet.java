package com.bko.sheetmirror.batch;

import com.bko.sheetmirror.model.SheetProperties;
import com.google.api.services.sheets.v4.model.AddSheetRequest;
import com.google.api.services.sheets.v4.model.Request;

public record AddSheet(SheetProperties properties) implements BatchOperation {
    @Override
    public Request toRequest() {
        return new Request().setAddSheet(new AddSheetRequest().setProperties(properties.toApi()));
    }
}
