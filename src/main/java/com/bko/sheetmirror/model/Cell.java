package com.bko.sheetmirror.model;

public class Cell {
    private final int row;
    private final int column;
    private String value;

    public Cell(int row, int column, String value) {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Cell position is 1-indexed, got row " + row + ", column " + column);
        }
        this.row = row;
        this.column = column;
        this.value = value == null ? "" : value;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }

    void setValue(String value) {
        this.value = value == null ? "" : value;
    }

    public String position() {
        return columnLetters(column) + row;
    }

    public static String columnLetters(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("Column is 1-indexed, got " + column);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            letters.insert(0, (char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    @Override
    public String toString() {
        return position() + "=" + value;
    }
}
