package com.bko.sheetmirror.batch;

import com.google.api.services.sheets.v4.model.DimensionRange;
import com.google.api.services.sheets.v4.model.InsertDimensionRequest;
import com.google.api.services.sheets.v4.model.Request;

public record InsertDimension(DimensionRange range, boolean inheritFromBefore) implements BatchOperation {
    @Override
    public Request toRequest() {
        return new Request()
                .setInsertDimension(new InsertDimensionRequest()
                        .setRange(range)
                        .setInheritFromBefore(inheritFromBefore));
    }
}
