package com.bko.sheetmirror.batch;

import com.bko.sheetmirror.model.Dimension;
import com.google.api.services.sheets.v4.model.DimensionRange;

final class DimensionRanges {
    private DimensionRanges() {
    }

    // Zero-based, half-open: [startIndex, endIndex).
    static DimensionRange of(int sheetId, Dimension dimension, int startIndex, int endIndex) {
        if (dimension == null) {
            throw new IllegalArgumentException("Dimension must not be null");
        }
        if (startIndex < 0 || endIndex <= startIndex) {
            throw new IllegalArgumentException("Invalid range [" + startIndex + ", " + endIndex + ")");
        }
        return new DimensionRange()
                .setSheetId(sheetId)
                .setDimension(dimension.name())
                .setStartIndex(startIndex)
                .setEndIndex(endIndex);
    }
}
