package com.bko.sheetmirror.shared;

import com.google.api.services.sheets.v4.SheetsScopes;

import java.util.List;

public record GoogleSettings(String spreadsheetId, String serviceAccountKeyPath, List<String> scopes) {
    public static final String SPREADSHEETS_SCOPE = SheetsScopes.SPREADSHEETS;

    public GoogleSettings {
        scopes = scopes == null || scopes.isEmpty() ? List.of(SPREADSHEETS_SCOPE) : List.copyOf(scopes);
    }

    public boolean isConfigured() {
        return hasText(serviceAccountKeyPath);
    }

    public boolean hasSpreadsheetId() {
        return hasText(spreadsheetId);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
