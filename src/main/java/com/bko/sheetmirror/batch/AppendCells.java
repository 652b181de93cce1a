package com.bko.sheetmirror.batch;

import com.google.api.services.sheets.v4.model.AppendCellsRequest;
import com.google.api.services.sheets.v4.model.CellData;
import com.google.api.services.sheets.v4.model.ExtendedValue;
import com.google.api.services.sheets.v4.model.Request;
import com.google.api.services.sheets.v4.model.RowData;

import java.util.List;
import java.util.stream.Collectors;

public record AppendCells(int sheetId, List<RowData> rows, String fields) implements BatchOperation {
    public static final String USER_ENTERED_VALUE = "userEnteredValue";

    public static AppendCells ofStrings(int sheetId, List<List<String>> rows) {
        List<RowData> data = rows.stream().map(AppendCells::row).collect(Collectors.toList());
        return new AppendCells(sheetId, data, USER_ENTERED_VALUE);
    }

    @Override
    public Request toRequest() {
        return new Request()
                .setAppendCells(new AppendCellsRequest()
                        .setSheetId(sheetId)
                        .setRows(rows)
                        .setFields(fields));
    }

    private static RowData row(List<String> values) {
        List<CellData> cells = values.stream()
                .map(v -> new CellData().setUserEnteredValue(new ExtendedValue().setStringValue(v == null ? "" : v)))
                .collect(Collectors.toList());
        return new RowData().setValues(cells);
    }
}
