package com.bko.sheetmirror.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class Spreadsheet {
    private final String id;
    private SpreadsheetProperties properties;
    private List<Sheet> sheets = new ArrayList<>();

    public Spreadsheet(String id, SpreadsheetProperties properties) {
        this.id = id;
        this.properties = properties;
    }

    public String getId() {
        return id;
    }

    public boolean isInitialized() {
        return id != null && !id.isBlank();
    }

    public SpreadsheetProperties getProperties() {
        return properties;
    }

    public String getTitle() {
        return properties == null ? null : properties.title();
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    public Optional<Sheet> sheetById(int sheetId) {
        return sheets.stream().filter(s -> s.getSheetId() == sheetId).findFirst();
    }

    public Optional<Sheet> sheetByTitle(String title) {
        return sheets.stream().filter(s -> Objects.equals(s.getTitle(), title)).findFirst();
    }

    public Optional<Sheet> sheetByIndex(int index) {
        if (index < 0 || index >= sheets.size()) {
            return Optional.empty();
        }
        return Optional.of(sheets.get(index));
    }

    // Sheets held before the call are detached afterwards.
    public void replaceContents(SpreadsheetProperties properties, List<Sheet> sheets) {
        for (Sheet sheet : sheets) {
            if (sheet.getSpreadsheet() != this) {
                throw new IllegalArgumentException("Sheet " + sheet + " belongs to another spreadsheet");
            }
        }
        this.properties = properties;
        this.sheets = new ArrayList<>(sheets);
    }

    @Override
    public String toString() {
        return "Spreadsheet{" + id + ", '" + getTitle() + "', sheets=" + sheets.size() + "}";
    }
}
