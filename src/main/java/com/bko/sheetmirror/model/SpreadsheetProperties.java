package com.bko.sheetmirror.model;

public record SpreadsheetProperties(String title, String locale, String autoRecalc, String timeZone) {
    public static SpreadsheetProperties titled(String title) {
        return new SpreadsheetProperties(title, null, null, null);
    }

    public static SpreadsheetProperties fromApi(com.google.api.services.sheets.v4.model.SpreadsheetProperties properties) {
        if (properties == null) {
            return null;
        }
        return new SpreadsheetProperties(
                properties.getTitle(),
                properties.getLocale(),
                properties.getAutoRecalc(),
                properties.getTimeZone());
    }

    public com.google.api.services.sheets.v4.model.SpreadsheetProperties toApi() {
        return new com.google.api.services.sheets.v4.model.SpreadsheetProperties()
                .setTitle(title)
                .setLocale(locale)
                .setAutoRecalc(autoRecalc)
                .setTimeZone(timeZone);
    }

    public SpreadsheetProperties withTitle(String value) {
        return new SpreadsheetProperties(value, locale, autoRecalc, timeZone);
    }

    public SpreadsheetProperties withLocale(String value) {
        return new SpreadsheetProperties(title, value, autoRecalc, timeZone);
    }

    public SpreadsheetProperties withAutoRecalc(String value) {
        return new SpreadsheetProperties(title, locale, value, timeZone);
    }

    public SpreadsheetProperties withTimeZone(String value) {
        return new SpreadsheetProperties(title, locale, autoRecalc, value);
    }
}
