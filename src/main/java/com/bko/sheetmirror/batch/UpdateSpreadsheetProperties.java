package com.bko.sheetmirror.batch;

import com.google.api.services.sheets.v4.model.Request;
import com.google.api.services.sheets.v4.model.SpreadsheetProperties;
import com.google.api.services.sheets.v4.model.UpdateSpreadsheetPropertiesRequest;

import java.util.Optional;

public record UpdateSpreadsheetProperties(SpreadsheetProperties properties, String fields) implements BatchOperation {

    // A null proposed title is left unchanged.
    public static Optional<UpdateSpreadsheetProperties> diff(
            com.bko.sheetmirror.model.SpreadsheetProperties current,
            com.bko.sheetmirror.model.SpreadsheetProperties proposed) {
        if (proposed == null) {
            throw new IllegalArgumentException("Proposed spreadsheet properties must not be null");
        }
        com.bko.sheetmirror.model.SpreadsheetProperties known = current != null
                ? current
                : new com.bko.sheetmirror.model.SpreadsheetProperties(null, null, null, null);
        FieldMask mask = new FieldMask();
        SpreadsheetProperties patch = new SpreadsheetProperties();

        if (proposed.title() != null && mask.compare("title", known.title(), proposed.title())) {
            patch.setTitle(proposed.title());
        }
        if (mask.compare("locale", known.locale(), proposed.locale())) {
            patch.setLocale(proposed.locale());
        }
        if (mask.compare("autoRecalc", known.autoRecalc(), proposed.autoRecalc())) {
            patch.setAutoRecalc(proposed.autoRecalc());
        }
        if (mask.compare("timeZone", known.timeZone(), proposed.timeZone())) {
            patch.setTimeZone(proposed.timeZone());
        }

        if (mask.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new UpdateSpreadsheetProperties(patch, mask.toString()));
    }

    @Override
    public Request toRequest() {
        return new Request()
                .setUpdateSpreadsheetProperties(new UpdateSpreadsheetPropertiesRequest()
                        .setProperties(properties)
                        .setFields(fields));
    }
}
