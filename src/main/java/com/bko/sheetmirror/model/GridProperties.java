package com.bko.sheetmirror.model;

public record GridProperties(
        int rowCount,
        int columnCount,
        int frozenRowCount,
        int frozenColumnCount,
        boolean hideGridlines
) {
    public static final GridProperties EMPTY = new GridProperties(0, 0, 0, 0, false);

    public static GridProperties of(int rowCount, int columnCount) {
        return new GridProperties(rowCount, columnCount, 0, 0, false);
    }

    public static GridProperties fromApi(com.google.api.services.sheets.v4.model.GridProperties grid) {
        if (grid == null) {
            return null;
        }
        return new GridProperties(
                orZero(grid.getRowCount()),
                orZero(grid.getColumnCount()),
                orZero(grid.getFrozenRowCount()),
                orZero(grid.getFrozenColumnCount()),
                Boolean.TRUE.equals(grid.getHideGridlines()));
    }

    public com.google.api.services.sheets.v4.model.GridProperties toApi() {
        return new com.google.api.services.sheets.v4.model.GridProperties()
                .setRowCount(rowCount)
                .setColumnCount(columnCount)
                .setFrozenRowCount(frozenRowCount)
                .setFrozenColumnCount(frozenColumnCount)
                .setHideGridlines(hideGridlines);
    }

    public GridProperties withRowCount(int value) {
        return new GridProperties(value, columnCount, frozenRowCount, frozenColumnCount, hideGridlines);
    }

    public GridProperties withColumnCount(int value) {
        return new GridProperties(rowCount, value, frozenRowCount, frozenColumnCount, hideGridlines);
    }

    public GridProperties withFrozenRowCount(int value) {
        return new GridProperties(rowCount, columnCount, value, frozenColumnCount, hideGridlines);
    }

    public GridProperties withFrozenColumnCount(int value) {
        return new GridProperties(rowCount, columnCount, frozenRowCount, value, hideGridlines);
    }

    public GridProperties withHideGridlines(boolean value) {
        return new GridProperties(rowCount, columnCount, frozenRowCount, frozenColumnCount, value);
    }

    public int count(Dimension dimension) {
        return dimension == Dimension.ROWS ? rowCount : columnCount;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
