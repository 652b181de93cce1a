package com.bko.sheetmirror.batch;

import com.bko.sheetmirror.model.Cell;
import com.bko.sheetmirror.model.Sheet;
import com.bko.sheetmirror.model.Spreadsheet;
import com.bko.sheetmirror.transport.SheetsClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.api.services.sheets.v4.model.BatchUpdateValuesRequest;
import com.google.api.services.sheets.v4.model.ValueRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

public class ValuesBatchUpdate {
    private static final Logger logger = LoggerFactory.getLogger(ValuesBatchUpdate.class);
    public static final String USER_ENTERED = "USER_ENTERED";
    public static final String RAW = "RAW";
    private static final String COLUMNS = "COLUMNS";
    private static final Pattern PLAIN_TITLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final SheetsClient client;
    private final Spreadsheet spreadsheet;
    private final String valueInputOption;
    private final List<ValueRange> data = new ArrayList<>();

    private ValuesBatchUpdate(SheetsClient client, Spreadsheet spreadsheet, String valueInputOption) {
        this.client = client;
        this.spreadsheet = spreadsheet;
        this.valueInputOption = valueInputOption;
    }

    public static ValuesBatchUpdate open(SheetsClient client, Spreadsheet spreadsheet) {
        return open(client, spreadsheet, USER_ENTERED);
    }

    public static ValuesBatchUpdate open(SheetsClient client, Spreadsheet spreadsheet, String valueInputOption) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if (spreadsheet == null) {
            throw new IllegalArgumentException("spreadsheet must not be null");
        }
        if (!spreadsheet.isInitialized()) {
            throw new IllegalArgumentException("spreadsheet has no id");
        }
        return new ValuesBatchUpdate(client, spreadsheet, valueInputOption);
    }

    public ValuesBatchUpdate put(Sheet sheet, Cell cell) {
        if (sheet == null || cell == null) {
            throw new IllegalArgumentException("sheet and cell must not be null");
        }
        data.add(new ValueRange()
                .setRange(qualifiedRange(sheet.getTitle(), cell.position()))
                .setMajorDimension(COLUMNS)
                .setValues(List.of(List.<Object>of(cell.getValue()))));
        return this;
    }

    public ValuesBatchUpdate putModifiedCells(Sheet sheet) {
        for (Cell cell : sheet.getModifiedCells()) {
            put(sheet, cell);
        }
        return this;
    }

    public List<ValueRange> getData() {
        return Collections.unmodifiableList(data);
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public JsonNode submit() throws IOException {
        if (data.isEmpty()) {
            throw new EmptyBatchException("Value ranges must not be empty");
        }
        logger.debug("Writing {} cell(s) to spreadsheet {}", data.size(), spreadsheet.getId());
        BatchUpdateValuesRequest request = new BatchUpdateValuesRequest()
                .setValueInputOption(valueInputOption)
                .setData(new ArrayList<>(data));
        return client.post(path(spreadsheet.getId()), request);
    }

    static String path(String spreadsheetId) {
        return "/spreadsheets/" + spreadsheetId + "/values:batchUpdate";
    }

    public static String qualifiedRange(String sheetTitle, String a1) {
        if (sheetTitle != null && PLAIN_TITLE.matcher(sheetTitle).matches()) {
            return sheetTitle + "!" + a1;
        }
        String escaped = sheetTitle == null ? "" : sheetTitle.replace("'", "''");
        return "'" + escaped + "'!" + a1;
    }
}
