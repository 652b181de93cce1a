package com.bko.sheetmirror.sync;

import com.bko.sheetmirror.model.Sheet;
import com.bko.sheetmirror.model.Spreadsheet;
import com.bko.sheetmirror.transport.DecodeException;
import com.bko.sheetmirror.transport.RemoteApiException;
import com.bko.sheetmirror.transport.RequestExecutor;
import com.bko.sheetmirror.transport.SheetsClient;
import com.google.api.services.sheets.v4.model.CellData;
import com.google.api.services.sheets.v4.model.ExtendedValue;
import com.google.api.services.sheets.v4.model.GridData;
import com.google.api.services.sheets.v4.model.RowData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bko.sheetmirror.SpreadsheetFixtures.NOTES_SHEET_ID;
import static com.bko.sheetmirror.SpreadsheetFixtures.SHEET_ID;
import static com.bko.sheetmirror.SpreadsheetFixtures.SPREADSHEET_ID;
import static com.bko.sheetmirror.SpreadsheetFixtures.json;
import static com.bko.sheetmirror.SpreadsheetFixtures.spreadsheet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpreadsheetSynchronizerTest {
    private RequestExecutor executor;
    private SpreadsheetSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        executor = mock(RequestExecutor.class);
        synchronizer = new SpreadsheetSynchronizer(new SheetsClient(executor));
    }

    @Test
    void pathRequestsOnlyTheMirroredFields() {
        String path = SpreadsheetSynchronizer.path("abc");

        assertTrue(path.startsWith("/spreadsheets/abc?fields=spreadsheetId%2Cproperties%28title"));
        assertFalse(path.contains(" "));
        assertFalse(path.substring(path.indexOf('?')).contains("("));
    }

    @Test
    void fetchBuildsTheMirror() throws Exception {
        when(executor.get(SpreadsheetSynchronizer.path(SPREADSHEET_ID))).thenReturn(spreadsheet("Sheet1", 100, 26));

        Spreadsheet spreadsheet = synchronizer.fetch(SPREADSHEET_ID);

        assertEquals(SPREADSHEET_ID, spreadsheet.getId());
        assertEquals("Budget", spreadsheet.getTitle());
        assertEquals("Etc/GMT", spreadsheet.getProperties().timeZone());
        assertEquals(2, spreadsheet.getSheets().size());

        Sheet sheet = spreadsheet.sheetById(SHEET_ID).orElseThrow();
        assertSame(spreadsheet, sheet.getSpreadsheet());
        assertEquals("Sheet1", sheet.getTitle());
        assertEquals(100, sheet.getGridProperties().rowCount());
        assertEquals(26, sheet.getGridProperties().columnCount());
        assertEquals(100, sheet.getNewMaxRow());
        assertEquals(26, sheet.getNewMaxColumn());
        assertFalse(sheet.hasPendingChanges());
        assertEquals("Name", sheet.getValue(1, 1));
        assertEquals("3", sheet.getValue(2, 2));
        assertEquals("", sheet.getValue(3, 1));
        assertEquals("TRUE", sheet.getValue(4, 1));
        assertEquals("=SUM(B2:B3)", sheet.getValue(4, 2));

        Sheet notes = spreadsheet.sheetByTitle("Notes").orElseThrow();
        assertEquals(NOTES_SHEET_ID, notes.getSheetId());
        assertEquals(1, notes.getProperties().index());
        assertTrue(notes.getProperties().hidden());
        assertEquals(1, notes.getGridProperties().frozenRowCount());
        assertTrue(notes.getRows().isEmpty());
    }

    @Test
    void reloadReplacesSheetsWholesale() throws Exception {
        when(executor.get(SpreadsheetSynchronizer.path(SPREADSHEET_ID)))
                .thenReturn(spreadsheet("Sheet1", 100, 26), spreadsheet("Data", 97, 26));
        Spreadsheet spreadsheet = synchronizer.fetch(SPREADSHEET_ID);
        Sheet before = spreadsheet.sheetById(SHEET_ID).orElseThrow();

        synchronizer.reload(spreadsheet);

        Sheet after = spreadsheet.sheetById(SHEET_ID).orElseThrow();
        assertNotSame(before, after);
        assertFalse(spreadsheet.getSheets().contains(before));
        assertEquals("Data", after.getTitle());
        assertEquals(97, after.getGridProperties().rowCount());
        assertFalse(after.hasPendingChanges());
        assertEquals(97, after.getNewMaxRow());
    }

    @Test
    void reloadMovesUnflushedWritesToTheReplacingSheet() throws Exception {
        when(executor.get(SpreadsheetSynchronizer.path(SPREADSHEET_ID)))
                .thenReturn(spreadsheet("Sheet1", 100, 26), spreadsheet("Data", 100, 26));
        Spreadsheet spreadsheet = synchronizer.fetch(SPREADSHEET_ID);
        Sheet before = spreadsheet.sheetById(SHEET_ID).orElseThrow();
        before.update(1, 3, "pending");
        before.update(200, 1, "beyond");

        synchronizer.reload(spreadsheet);

        Sheet after = spreadsheet.sheetById(SHEET_ID).orElseThrow();
        assertTrue(after.hasPendingChanges());
        assertEquals("pending", after.getValue(1, 3));
        assertEquals("beyond", after.getValue(200, 1));
        assertEquals(200, after.getNewMaxRow());
        assertEquals("Name", after.getValue(1, 1));
        assertFalse(before.hasPendingChanges());
    }

    @Test
    void missingSheetIdAndIndexAreNormalizedToZero() throws Exception {
        when(executor.get(SpreadsheetSynchronizer.path("def"))).thenReturn(json(
                "{\"spreadsheetId\":\"def\",\"properties\":{\"title\":\"Fresh\"},"
                        + "\"sheets\":[{\"properties\":{\"title\":\"Sheet1\",\"gridProperties\":{\"rowCount\":1000,\"columnCount\":26}}}]}"));

        Sheet sheet = synchronizer.fetch("def").getSheets().get(0);

        assertEquals(0, sheet.getProperties().sheetId());
        assertEquals(0, sheet.getProperties().index());
        assertEquals(1000, sheet.getNewMaxRow());
    }

    @Test
    void remoteErrorSurfacesFromFetch() throws Exception {
        when(executor.get(SpreadsheetSynchronizer.path("gone"))).thenReturn(json(
                "{\"error\":{\"code\":404,\"status\":\"NOT_FOUND\",\"message\":\"Requested entity was not found.\"}}"));

        RemoteApiException e = assertThrows(RemoteApiException.class, () -> synchronizer.fetch("gone"));
        assertEquals(404, e.getCode());
    }

    @Test
    void responseWithoutSpreadsheetIdIsADecodeFailure() throws Exception {
        when(executor.get(SpreadsheetSynchronizer.path("abc"))).thenReturn(json("{\"properties\":{\"title\":\"x\"}}"));

        assertThrows(DecodeException.class, () -> synchronizer.fetch("abc"));
    }

    @Test
    void toValuesHonoursGridOffsets() {
        List<List<String>> values = SpreadsheetSynchronizer.toValues(List.of(new GridData()
                .setStartRow(1)
                .setStartColumn(2)
                .setRowData(List.of(new RowData().setValues(List.of(text("x"), text("y")))))));

        assertEquals(List.of(List.of(), List.of("", "", "x", "y")), values);
    }

    @Test
    void numbersAreRenderedWithoutTrailingZeros() {
        assertEquals("3", SpreadsheetSynchronizer.text(new ExtendedValue().setNumberValue(3.0)));
        assertEquals("2.5", SpreadsheetSynchronizer.text(new ExtendedValue().setNumberValue(2.50)));
        assertEquals("FALSE", SpreadsheetSynchronizer.text(new ExtendedValue().setBoolValue(false)));
        assertEquals("", SpreadsheetSynchronizer.text(null));
    }

    private static CellData text(String value) {
        return new CellData().setUserEnteredValue(new ExtendedValue().setStringValue(value));
    }
}
