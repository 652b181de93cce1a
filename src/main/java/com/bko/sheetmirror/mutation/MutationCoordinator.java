package com.bko.sheetmirror.mutation;

import com.bko.sheetmirror.batch.BatchUpdate;
import com.bko.sheetmirror.batch.ValuesBatchUpdate;
import com.bko.sheetmirror.model.Dimension;
import com.bko.sheetmirror.model.GridProperties;
import com.bko.sheetmirror.model.Sheet;
import com.bko.sheetmirror.model.SheetProperties;
import com.bko.sheetmirror.model.Spreadsheet;
import com.bko.sheetmirror.model.SpreadsheetProperties;
import com.bko.sheetmirror.sync.SpreadsheetSynchronizer;
import com.bko.sheetmirror.transport.DecodeException;
import com.bko.sheetmirror.transport.SheetsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One call per supported mutation: build the batch, submit it and, on success, resynchronize the
 * mirror. Calls block for the whole round trip.
 *
 * <p>Not thread-safe. Callers must serialize mutations against one spreadsheet themselves, since
 * row and column bookkeeping is applied to the local mirror before the server answers. When such
 * a call fails, the bookkeeping stays applied; {@link #reconcile(Spreadsheet)} refetches the
 * authoritative state.
 */
@Service
public class MutationCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(MutationCoordinator.class);

    private final SheetsClient client;
    private final SpreadsheetSynchronizer synchronizer;

    public MutationCoordinator(SheetsClient client, SpreadsheetSynchronizer synchronizer) {
        this.client = client;
        this.synchronizer = synchronizer;
    }

    public Spreadsheet createSpreadsheet(SpreadsheetProperties properties, SheetProperties... sheets) throws IOException {
        if (properties == null || properties.title() == null || properties.title().isBlank()) {
            throw new IllegalArgumentException("A spreadsheet title is required");
        }
        List<com.google.api.services.sheets.v4.model.Sheet> newSheets = Arrays.stream(sheets)
                .map(p -> new com.google.api.services.sheets.v4.model.Sheet().setProperties(p.toApi()))
                .collect(Collectors.toList());
        com.google.api.services.sheets.v4.model.Spreadsheet body = new com.google.api.services.sheets.v4.model.Spreadsheet()
                .setProperties(properties.toApi())
                .setSheets(newSheets.isEmpty() ? null : newSheets);
        com.google.api.services.sheets.v4.model.Spreadsheet created =
                client.post("/spreadsheets", body, com.google.api.services.sheets.v4.model.Spreadsheet.class);
        String id = created.getSpreadsheetId();
        if (id == null || id.isBlank()) {
            throw new DecodeException("Create response carries no spreadsheetId");
        }
        logger.info("Created spreadsheet {} '{}'", id, properties.title());
        return synchronizer.fetch(id);
    }

    public boolean updateSpreadsheetProperties(Spreadsheet spreadsheet, SpreadsheetProperties proposed) throws IOException {
        BatchUpdate batch = BatchUpdate.open(client, spreadsheet).updateSpreadsheetProperties(proposed);
        if (batch.isEmpty()) {
            logger.debug("Spreadsheet {} already matches the proposed properties", spreadsheet.getId());
            return false;
        }
        submitAndReload(batch);
        return true;
    }

    public boolean renameSpreadsheet(Spreadsheet spreadsheet, String title) throws IOException {
        requireSpreadsheet(spreadsheet);
        SpreadsheetProperties current = spreadsheet.getProperties();
        SpreadsheetProperties proposed = current == null ? SpreadsheetProperties.titled(title) : current.withTitle(title);
        return updateSpreadsheetProperties(spreadsheet, proposed);
    }

    public boolean updateSheetProperties(Sheet sheet, SheetProperties proposed) throws IOException {
        sheet = attached(sheet);
        BatchUpdate batch = BatchUpdate.open(client, sheet.getSpreadsheet()).updateSheetProperties(sheet, proposed);
        if (batch.isEmpty()) {
            logger.debug("{} already matches the proposed properties", sheet);
            return false;
        }
        submitAndReload(batch);
        return true;
    }

    public boolean renameSheet(Sheet sheet, String title) throws IOException {
        sheet = attached(sheet);
        return updateSheetProperties(sheet, sheet.getProperties().withTitle(title));
    }

    public boolean resizeSheet(Sheet sheet, int rowCount, int columnCount) throws IOException {
        sheet = attached(sheet);
        requirePositive(rowCount, columnCount);
        GridProperties grid = sheet.getGridProperties().withRowCount(rowCount).withColumnCount(columnCount);
        return updateSheetProperties(sheet, sheet.getProperties().withGridProperties(grid));
    }

    public boolean setSheetHidden(Sheet sheet, boolean hidden) throws IOException {
        sheet = attached(sheet);
        return updateSheetProperties(sheet, sheet.getProperties().withHidden(hidden));
    }

    public boolean moveSheet(Sheet sheet, int index) throws IOException {
        sheet = attached(sheet);
        if (index < 0) {
            throw new IllegalArgumentException("Sheet index must not be negative: " + index);
        }
        return updateSheetProperties(sheet, sheet.getProperties().withIndex(index));
    }

    public void addSheet(Spreadsheet spreadsheet, SheetProperties properties) throws IOException {
        BatchUpdate batch = BatchUpdate.open(client, spreadsheet).addSheet(properties);
        logger.info("Adding sheet '{}' to spreadsheet {}", properties.title(), spreadsheet.getId());
        submitAndReload(batch);
    }

    public void deleteSheet(Spreadsheet spreadsheet, int sheetId) throws IOException {
        BatchUpdate batch = BatchUpdate.open(client, spreadsheet).deleteSheet(sheetId);
        logger.info("Deleting sheet {} from spreadsheet {}", sheetId, spreadsheet.getId());
        submitAndReload(batch);
    }

    public void insertRows(Sheet sheet, int start, int end) throws IOException {
        insertDimension(sheet, Dimension.ROWS, start, end);
    }

    public void insertColumns(Sheet sheet, int start, int end) throws IOException {
        insertDimension(sheet, Dimension.COLUMNS, start, end);
    }

    // [start, end), zero-based
    public void deleteRows(Sheet sheet, int start, int end) throws IOException {
        deleteDimension(sheet, Dimension.ROWS, start, end);
    }

    public void deleteColumns(Sheet sheet, int start, int end) throws IOException {
        deleteDimension(sheet, Dimension.COLUMNS, start, end);
    }

    public void appendCells(Sheet sheet, List<List<String>> rows) throws IOException {
        sheet = attached(sheet);
        BatchUpdate batch = BatchUpdate.open(client, sheet.getSpreadsheet()).appendCells(sheet, rows);
        logger.info("Appending {} row(s) to {}", rows.size(), sheet);
        submitAndReload(batch);
    }

    // No refetch; the accepted size becomes the confirmed grid size.
    public void expandSheet(Sheet sheet, int rowCount, int columnCount) throws IOException {
        sheet = attached(sheet);
        requirePositive(rowCount, columnCount);
        GridProperties grid = sheet.getGridProperties().withRowCount(rowCount).withColumnCount(columnCount);
        BatchUpdate batch = BatchUpdate.open(client, sheet.getSpreadsheet())
                .updateSheetProperties(sheet, sheet.getProperties().withGridProperties(grid));
        if (batch.isEmpty()) {
            return;
        }
        logger.info("Expanding {} to {} rows x {} columns", sheet, rowCount, columnCount);
        batch.submit();
        sheet.confirmGridSize(rowCount, columnCount);
    }

    // The values endpoint rejects cells outside the grid, so it is expanded first.
    public void synchronize(Sheet sheet) throws IOException {
        sheet = attached(sheet);
        if (sheet.exceedsGrid()) {
            expandSheet(sheet, sheet.getNewMaxRow(), sheet.getNewMaxColumn());
        }
        if (sheet.hasPendingChanges()) {
            int count = sheet.getModifiedCells().size();
            ValuesBatchUpdate.open(client, sheet.getSpreadsheet())
                    .putModifiedCells(sheet)
                    .submit();
            logger.info("Flushed {} cell(s) to {}", count, sheet);
        }
        sheet.markFlushed();
    }

    public void reconcile(Spreadsheet spreadsheet) throws IOException {
        requireSpreadsheet(spreadsheet);
        synchronizer.reload(spreadsheet);
    }

    private void insertDimension(Sheet sheet, Dimension dimension, int start, int end) throws IOException {
        sheet = attached(sheet);
        BatchUpdate batch = BatchUpdate.open(client, sheet.getSpreadsheet())
                .insertDimension(sheet, dimension, start, end, false);
        sheet.shiftDimension(dimension, end - start);
        logger.info("Inserting {} {} at {} in {}", end - start, dimension, start, sheet);
        submitShifted(batch, sheet);
    }

    private void deleteDimension(Sheet sheet, Dimension dimension, int start, int end) throws IOException {
        sheet = attached(sheet);
        BatchUpdate batch = BatchUpdate.open(client, sheet.getSpreadsheet())
                .deleteDimension(sheet, dimension, start, end);
        sheet.shiftDimension(dimension, -(end - start));
        logger.info("Deleting {} [{}, {}) from {}", dimension, start, end, sheet);
        submitShifted(batch, sheet);
    }

    private void submitShifted(BatchUpdate batch, Sheet sheet) throws IOException {
        try {
            batch.submit();
        } catch (IOException e) {
            logger.warn("Batch for {} failed after local counts were shifted; reconcile to repair: {}", sheet, e.getMessage());
            throw e;
        }
        synchronizer.reload(batch.getSpreadsheet());
    }

    private void submitAndReload(BatchUpdate batch) throws IOException {
        batch.submit();
        synchronizer.reload(batch.getSpreadsheet());
    }

    private static void requireSpreadsheet(Spreadsheet spreadsheet) {
        if (spreadsheet == null || !spreadsheet.isInitialized()) {
            throw new IllegalArgumentException("spreadsheet must not be null and must have an id");
        }
    }

    // Resolves a sheet detached by a reload to its current counterpart, moving its writes over.
    private static Sheet attached(Sheet sheet) {
        if (sheet == null) {
            throw new IllegalArgumentException("sheet must not be null");
        }
        Spreadsheet spreadsheet = sheet.getSpreadsheet();
        if (spreadsheet.getSheets().contains(sheet)) {
            return sheet;
        }
        Sheet current = spreadsheet.sheetById(sheet.getSheetId())
                .orElseThrow(() -> new IllegalArgumentException(sheet + " no longer exists in " + spreadsheet));
        current.adoptPending(sheet);
        return current;
    }

    private static void requirePositive(int rowCount, int columnCount) {
        if (rowCount < 1 || columnCount < 1) {
            throw new IllegalArgumentException("Grid must have at least one row and column, got "
                    + rowCount + " x " + columnCount);
        }
    }
}
