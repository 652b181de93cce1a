package com.bko.sheetmirror.sync;

import com.bko.sheetmirror.model.Sheet;
import com.bko.sheetmirror.model.SheetProperties;
import com.bko.sheetmirror.model.Spreadsheet;
import com.bko.sheetmirror.model.SpreadsheetProperties;
import com.bko.sheetmirror.transport.DecodeException;
import com.bko.sheetmirror.transport.SheetsClient;
import com.google.api.services.sheets.v4.model.CellData;
import com.google.api.services.sheets.v4.model.ExtendedValue;
import com.google.api.services.sheets.v4.model.GridData;
import com.google.api.services.sheets.v4.model.RowData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Refetches authoritative state and overwrites the local mirror. Properties and the whole sheet
 * collection are replaced; unflushed cell writes move to the sheet with the same id.
 */
@Component
public class SpreadsheetSynchronizer {
    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetSynchronizer.class);

    public static final String FIELDS = "spreadsheetId,properties(title,locale,autoRecalc,timeZone),"
            + "sheets(properties,data.rowData.values(userEnteredValue))";

    private final SheetsClient client;

    public SpreadsheetSynchronizer(SheetsClient client) {
        this.client = client;
    }

    public Spreadsheet fetch(String spreadsheetId) throws IOException {
        com.google.api.services.sheets.v4.model.Spreadsheet remote = fetchRemote(spreadsheetId);
        SpreadsheetProperties properties = SpreadsheetProperties.fromApi(remote.getProperties());
        Spreadsheet spreadsheet = new Spreadsheet(remote.getSpreadsheetId(), properties);
        spreadsheet.replaceContents(properties, toSheets(spreadsheet, remote));
        logger.info("Fetched spreadsheet {} with {} sheet(s)", spreadsheet.getId(), spreadsheet.getSheets().size());
        return spreadsheet;
    }

    public void reload(Spreadsheet spreadsheet) throws IOException {
        if (spreadsheet == null || !spreadsheet.isInitialized()) {
            throw new IllegalArgumentException("spreadsheet must not be null and must have an id");
        }
        com.google.api.services.sheets.v4.model.Spreadsheet remote = fetchRemote(spreadsheet.getId());
        List<Sheet> sheets = toSheets(spreadsheet, remote);
        for (Sheet previous : spreadsheet.getSheets()) {
            if (previous.hasPendingChanges()) {
                carryPending(previous, sheets);
            }
        }
        spreadsheet.replaceContents(SpreadsheetProperties.fromApi(remote.getProperties()), sheets);
        logger.debug("Reloaded spreadsheet {}", spreadsheet.getId());
    }

    static String path(String spreadsheetId) {
        return "/spreadsheets/" + spreadsheetId + "?fields=" + URLEncoder.encode(FIELDS, StandardCharsets.UTF_8);
    }

    private com.google.api.services.sheets.v4.model.Spreadsheet fetchRemote(String spreadsheetId) throws IOException {
        if (spreadsheetId == null || spreadsheetId.isBlank()) {
            throw new IllegalArgumentException("spreadsheetId must not be blank");
        }
        com.google.api.services.sheets.v4.model.Spreadsheet remote =
                client.get(path(spreadsheetId), com.google.api.services.sheets.v4.model.Spreadsheet.class);
        if (remote == null || remote.getSpreadsheetId() == null) {
            throw new DecodeException("Response for spreadsheet " + spreadsheetId + " carries no spreadsheetId");
        }
        return remote;
    }

    private static void carryPending(Sheet previous, List<Sheet> replacements) {
        Optional<Sheet> replacement = replacements.stream()
                .filter(s -> s.getSheetId() == previous.getSheetId())
                .findFirst();
        if (replacement.isPresent()) {
            replacement.get().adoptPending(previous);
        } else {
            logger.warn("{} no longer exists; {} unflushed cell(s) stay on the detached sheet",
                    previous, previous.getModifiedCells().size());
        }
    }

    private static List<Sheet> toSheets(Spreadsheet owner, com.google.api.services.sheets.v4.model.Spreadsheet remote) {
        if (remote.getSheets() == null) {
            return new ArrayList<>();
        }
        List<Sheet> sheets = new ArrayList<>(remote.getSheets().size());
        for (com.google.api.services.sheets.v4.model.Sheet sheet : remote.getSheets()) {
            SheetProperties properties = sheet.getProperties() == null
                    ? new SheetProperties(0, null, 0, null, false, null, false)
                    : SheetProperties.fromApi(sheet.getProperties()).normalized();
            sheets.add(new Sheet(owner, properties, toValues(sheet.getData())));
        }
        return sheets;
    }

    static List<List<String>> toValues(List<GridData> data) {
        if (data == null || data.isEmpty()) {
            return List.of();
        }
        List<List<String>> values = new ArrayList<>();
        for (GridData grid : data) {
            if (grid.getRowData() == null) {
                continue;
            }
            int startRow = grid.getStartRow() == null ? 0 : grid.getStartRow();
            int startColumn = grid.getStartColumn() == null ? 0 : grid.getStartColumn();
            for (int r = 0; r < grid.getRowData().size(); r++) {
                int rowIndex = startRow + r;
                while (values.size() <= rowIndex) {
                    values.add(new ArrayList<>());
                }
                RowData row = grid.getRowData().get(r);
                List<CellData> cells = row == null || row.getValues() == null ? List.of() : row.getValues();
                List<String> target = values.get(rowIndex);
                for (int c = 0; c < cells.size(); c++) {
                    int columnIndex = startColumn + c;
                    while (target.size() <= columnIndex) {
                        target.add("");
                    }
                    CellData cell = cells.get(c);
                    target.set(columnIndex, cell == null ? "" : text(cell.getUserEnteredValue()));
                }
            }
        }
        return Collections.unmodifiableList(values);
    }

    static String text(ExtendedValue value) {
        if (value == null) {
            return "";
        }
        if (value.getStringValue() != null) {
            return value.getStringValue();
        }
        if (value.getNumberValue() != null) {
            return BigDecimal.valueOf(value.getNumberValue()).stripTrailingZeros().toPlainString();
        }
        if (value.getBoolValue() != null) {
            return value.getBoolValue() ? "TRUE" : "FALSE";
        }
        if (value.getFormulaValue() != null) {
            return value.getFormulaValue();
        }
        return "";
    }
}
