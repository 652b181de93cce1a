package com.bko.sheetmirror.batch;

import com.bko.sheetmirror.model.Dimension;
import com.bko.sheetmirror.model.Sheet;
import com.bko.sheetmirror.model.SheetProperties;
import com.bko.sheetmirror.model.Spreadsheet;
import com.bko.sheetmirror.model.SpreadsheetProperties;
import com.bko.sheetmirror.transport.SheetsClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.api.services.sheets.v4.model.BatchUpdateSpreadsheetRequest;
import com.google.api.services.sheets.v4.model.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered operations for one atomic {@code spreadsheets.batchUpdate} call against a single
 * spreadsheet. The server applies them in order; no cross-operation checks are made here.
 *
 * <p>Property updates are diffed when appended, against the snapshot known at that moment, and
 * are dropped when nothing differs. Not thread-safe.
 */
public class BatchUpdate {
    private static final Logger logger = LoggerFactory.getLogger(BatchUpdate.class);

    private final SheetsClient client;
    private final Spreadsheet spreadsheet;
    private final List<BatchOperation> operations = new ArrayList<>();

    private BatchUpdate(SheetsClient client, Spreadsheet spreadsheet) {
        this.client = client;
        this.spreadsheet = spreadsheet;
    }

    public static BatchUpdate open(SheetsClient client, Spreadsheet spreadsheet) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if (spreadsheet == null) {
            throw new IllegalArgumentException("spreadsheet must not be null");
        }
        if (!spreadsheet.isInitialized()) {
            throw new IllegalArgumentException("spreadsheet has no id");
        }
        return new BatchUpdate(client, spreadsheet);
    }

    public BatchUpdate add(BatchOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        operations.add(operation);
        return this;
    }

    public BatchUpdate updateSpreadsheetProperties(SpreadsheetProperties proposed) {
        UpdateSpreadsheetProperties.diff(spreadsheet.getProperties(), proposed).ifPresent(this::add);
        return this;
    }

    public BatchUpdate updateSheetProperties(Sheet sheet, SheetProperties proposed) {
        requireOwnSheet(sheet);
        UpdateSheetProperties.diff(sheet.getProperties(), proposed).ifPresent(this::add);
        return this;
    }

    public BatchUpdate addSheet(SheetProperties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        return add(new AddSheet(properties));
    }

    public BatchUpdate deleteSheet(int sheetId) {
        return add(new DeleteSheet(sheetId));
    }

    public BatchUpdate insertDimension(Sheet sheet, Dimension dimension, int start, int end, boolean inheritFromBefore) {
        requireOwnSheet(sheet);
        return add(new InsertDimension(DimensionRanges.of(sheet.getSheetId(), dimension, start, end), inheritFromBefore));
    }

    public BatchUpdate deleteDimension(Sheet sheet, Dimension dimension, int start, int end) {
        requireOwnSheet(sheet);
        return add(new DeleteDimension(DimensionRanges.of(sheet.getSheetId(), dimension, start, end)));
    }

    public BatchUpdate appendCells(Sheet sheet, List<List<String>> rows) {
        requireOwnSheet(sheet);
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("rows must not be empty");
        }
        return add(AppendCells.ofStrings(sheet.getSheetId(), rows));
    }

    public List<BatchOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public Spreadsheet getSpreadsheet() {
        return spreadsheet;
    }

    public JsonNode submit() throws IOException {
        if (operations.isEmpty()) {
            throw new EmptyBatchException("Requests must not be empty");
        }
        List<Request> requests = operations.stream()
                .map(BatchOperation::toRequest)
                .collect(Collectors.toList());
        logger.debug("Submitting {} operation(s) to spreadsheet {}", requests.size(), spreadsheet.getId());
        return client.post(path(spreadsheet.getId()), new BatchUpdateSpreadsheetRequest().setRequests(requests));
    }

    static String path(String spreadsheetId) {
        return "/spreadsheets/" + spreadsheetId + ":batchUpdate";
    }

    private void requireOwnSheet(Sheet sheet) {
        if (sheet == null) {
            throw new IllegalArgumentException("sheet must not be null");
        }
        if (sheet.getSpreadsheet() != spreadsheet) {
            throw new IllegalArgumentException(sheet + " does not belong to " + spreadsheet);
        }
    }
}
