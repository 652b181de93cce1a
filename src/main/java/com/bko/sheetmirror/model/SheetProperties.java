package com.bko.sheetmirror.model;

// sheetId is null only for a sheet that has not been added yet.
public record SheetProperties(
        Integer sheetId,
        String title,
        Integer index,
        GridProperties gridProperties,
        boolean hidden,
        Color tabColor,
        boolean rightToLeft
) {
    public static SheetProperties titled(String title) {
        return new SheetProperties(null, title, null, null, false, null, false);
    }

    public static SheetProperties fromApi(com.google.api.services.sheets.v4.model.SheetProperties properties) {
        return new SheetProperties(
                properties.getSheetId(),
                properties.getTitle(),
                properties.getIndex(),
                GridProperties.fromApi(properties.getGridProperties()),
                Boolean.TRUE.equals(properties.getHidden()),
                Color.fromApi(properties.getTabColor()),
                Boolean.TRUE.equals(properties.getRightToLeft()));
    }

    public com.google.api.services.sheets.v4.model.SheetProperties toApi() {
        return new com.google.api.services.sheets.v4.model.SheetProperties()
                .setSheetId(sheetId)
                .setTitle(title)
                .setIndex(index)
                .setGridProperties(gridProperties == null ? null : gridProperties.toApi())
                .setHidden(hidden)
                .setTabColor(tabColor == null ? null : tabColor.toApi())
                .setRightToLeft(rightToLeft);
    }

    public SheetProperties withTitle(String value) {
        return new SheetProperties(sheetId, value, index, gridProperties, hidden, tabColor, rightToLeft);
    }

    public SheetProperties withIndex(Integer value) {
        return new SheetProperties(sheetId, title, value, gridProperties, hidden, tabColor, rightToLeft);
    }

    public SheetProperties withGridProperties(GridProperties value) {
        return new SheetProperties(sheetId, title, index, value, hidden, tabColor, rightToLeft);
    }

    public SheetProperties withHidden(boolean value) {
        return new SheetProperties(sheetId, title, index, gridProperties, value, tabColor, rightToLeft);
    }

    public SheetProperties withTabColor(Color value) {
        return new SheetProperties(sheetId, title, index, gridProperties, hidden, value, rightToLeft);
    }

    public SheetProperties withRightToLeft(boolean value) {
        return new SheetProperties(sheetId, title, index, gridProperties, hidden, tabColor, value);
    }

    // Server responses omit zero-valued ids and indexes.
    public SheetProperties normalized() {
        return new SheetProperties(
                sheetId == null ? 0 : sheetId,
                title,
                index == null ? 0 : index,
                gridProperties,
                hidden,
                tabColor,
                rightToLeft);
    }
}
