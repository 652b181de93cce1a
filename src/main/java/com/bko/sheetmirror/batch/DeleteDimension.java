package com.bko.sheetmirror.batch;

import com.google.api.services.sheets.v4.model.DeleteDimensionRequest;
import com.google.api.services.sheets.v4.model.DimensionRange;
import com.google.api.services.sheets.v4.model.Request;

public record DeleteDimension(DimensionRange range) implements BatchOperation {
    @Override
    public Request toRequest() {
        return new Request().setDeleteDimension(new DeleteDimensionRequest().setRange(range));
    }
}
