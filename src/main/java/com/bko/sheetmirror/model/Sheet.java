package com.bko.sheetmirror.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Local mirror of one sheet.
 *
 * <p>The grid counts in {@link #getProperties()} are the confirmed state, last seen on or accepted
 * by the server. {@link #getNewMaxRow()} and {@link #getNewMaxColumn()} are the projected state:
 * the grid size that local writes need once flushed. The projection never drops below the confirmed
 * counts; {@link #reconcile()} rebases it on them.
 */
public class Sheet {
    private final Spreadsheet spreadsheet;
    private SheetProperties properties;
    private final List<List<Cell>> rows = new ArrayList<>();
    private final Set<Cell> modifiedCells = new LinkedHashSet<>();
    private int newMaxRow;
    private int newMaxColumn;

    public Sheet(Spreadsheet spreadsheet, SheetProperties properties) {
        this(spreadsheet, properties, List.of());
    }

    public Sheet(Spreadsheet spreadsheet, SheetProperties properties, List<List<String>> values) {
        if (spreadsheet == null) {
            throw new IllegalArgumentException("Sheet must belong to a spreadsheet");
        }
        if (properties == null) {
            throw new IllegalArgumentException("Sheet properties must not be null");
        }
        this.spreadsheet = spreadsheet;
        this.properties = properties;
        for (int r = 0; r < values.size(); r++) {
            List<String> rowValues = values.get(r);
            List<Cell> row = new ArrayList<>(rowValues.size());
            for (int c = 0; c < rowValues.size(); c++) {
                row.add(new Cell(r + 1, c + 1, rowValues.get(c)));
            }
            rows.add(row);
        }
        reconcile();
    }

    public Spreadsheet getSpreadsheet() {
        return spreadsheet;
    }

    public SheetProperties getProperties() {
        return properties;
    }

    public int getSheetId() {
        return properties.sheetId() == null ? 0 : properties.sheetId();
    }

    public String getTitle() {
        return properties.title();
    }

    public GridProperties getGridProperties() {
        return properties.gridProperties() == null ? GridProperties.EMPTY : properties.gridProperties();
    }

    public List<List<Cell>> getRows() {
        List<List<Cell>> view = new ArrayList<>(rows.size());
        for (List<Cell> row : rows) {
            view.add(Collections.unmodifiableList(row));
        }
        return Collections.unmodifiableList(view);
    }

    public String getValue(int row, int column) {
        Cell cell = findCell(row, column);
        return cell == null ? "" : cell.getValue();
    }

    public List<Cell> getModifiedCells() {
        return List.copyOf(modifiedCells);
    }

    public boolean hasPendingChanges() {
        return !modifiedCells.isEmpty();
    }

    public int getNewMaxRow() {
        return newMaxRow;
    }

    public int getNewMaxColumn() {
        return newMaxColumn;
    }

    public boolean exceedsGrid() {
        GridProperties grid = getGridProperties();
        return newMaxRow > grid.rowCount() || newMaxColumn > grid.columnCount();
    }

    // 1-indexed
    public void update(int row, int column, String value) {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Cell position is 1-indexed, got row " + row + ", column " + column);
        }
        while (rows.size() < row) {
            rows.add(new ArrayList<>());
        }
        List<Cell> cells = rows.get(row - 1);
        while (cells.size() < column) {
            cells.add(new Cell(row, cells.size() + 1, ""));
        }
        Cell cell = cells.get(column - 1);
        cell.setValue(value);
        modifiedCells.add(cell);
        newMaxRow = Math.max(newMaxRow, row);
        newMaxColumn = Math.max(newMaxColumn, column);
    }

    // Positive delta inserts, negative deletes.
    public void shiftDimension(Dimension dimension, int delta) {
        GridProperties grid = getGridProperties();
        if (dimension == Dimension.ROWS) {
            int count = Math.max(0, grid.rowCount() + delta);
            properties = properties.withGridProperties(grid.withRowCount(count));
            newMaxRow = Math.max(count, newMaxRow + delta);
        } else {
            int count = Math.max(0, grid.columnCount() + delta);
            properties = properties.withGridProperties(grid.withColumnCount(count));
            newMaxColumn = Math.max(count, newMaxColumn + delta);
        }
    }

    public void confirmGridSize(int rowCount, int columnCount) {
        properties = properties.withGridProperties(getGridProperties()
                .withRowCount(rowCount)
                .withColumnCount(columnCount));
        newMaxRow = Math.max(newMaxRow, rowCount);
        newMaxColumn = Math.max(newMaxColumn, columnCount);
    }

    public void markFlushed() {
        modifiedCells.clear();
        reconcile();
    }

    public void adoptPending(Sheet previous) {
        if (previous == this) {
            return;
        }
        for (Cell cell : previous.modifiedCells) {
            update(cell.getRow(), cell.getColumn(), cell.getValue());
        }
        previous.modifiedCells.clear();
        previous.reconcile();
    }

    // Cells still pending keep the projection large enough to address them.
    public void reconcile() {
        GridProperties grid = getGridProperties();
        newMaxRow = grid.rowCount();
        newMaxColumn = grid.columnCount();
        for (Cell cell : modifiedCells) {
            newMaxRow = Math.max(newMaxRow, cell.getRow());
            newMaxColumn = Math.max(newMaxColumn, cell.getColumn());
        }
    }

    private Cell findCell(int row, int column) {
        if (row < 1 || row > rows.size()) {
            return null;
        }
        List<Cell> cells = rows.get(row - 1);
        if (column < 1 || column > cells.size()) {
            return null;
        }
        return cells.get(column - 1);
    }

    @Override
    public String toString() {
        return "Sheet{" + getSheetId() + ", '" + getTitle() + "'}";
    }
}
