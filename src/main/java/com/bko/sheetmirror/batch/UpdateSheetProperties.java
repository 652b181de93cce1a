package com.bko.sheetmirror.batch;

import com.bko.sheetmirror.model.GridProperties;
import com.google.api.services.sheets.v4.model.Request;
import com.google.api.services.sheets.v4.model.SheetProperties;
import com.google.api.services.sheets.v4.model.UpdateSheetPropertiesRequest;

import java.util.Optional;

public record UpdateSheetProperties(SheetProperties properties, String fields) implements BatchOperation {

    /**
     * Builds the update carrying only the fields of {@code proposed} that differ from
     * {@code current}, or nothing when they are equal.
     *
     * <p>The sheet id always comes from {@code current} and is never part of the mask. A null
     * proposed title, index or grid leaves that part unchanged; a null tab colour clears it.
     */
    public static Optional<UpdateSheetProperties> diff(
            com.bko.sheetmirror.model.SheetProperties current,
            com.bko.sheetmirror.model.SheetProperties proposed) {
        if (current == null || current.sheetId() == null) {
            throw new IllegalArgumentException("Known sheet properties with a sheet id are required");
        }
        if (proposed == null) {
            throw new IllegalArgumentException("Proposed sheet properties must not be null");
        }
        FieldMask mask = new FieldMask();
        SheetProperties patch = new SheetProperties().setSheetId(current.sheetId());

        if (proposed.title() != null && mask.compare("title", current.title(), proposed.title())) {
            patch.setTitle(proposed.title());
        }
        if (proposed.index() != null && mask.compare("index", current.index(), proposed.index())) {
            patch.setIndex(proposed.index());
        }
        if (proposed.gridProperties() != null) {
            patch.setGridProperties(diffGrid(mask,
                    current.gridProperties() != null ? current.gridProperties() : GridProperties.EMPTY,
                    proposed.gridProperties()));
        }
        if (mask.compare("hidden", current.hidden(), proposed.hidden())) {
            patch.setHidden(proposed.hidden());
        }
        if (mask.compare("tabColor", current.tabColor(), proposed.tabColor()) && proposed.tabColor() != null) {
            patch.setTabColor(proposed.tabColor().toApi());
        }
        if (mask.compare("rightToLeft", current.rightToLeft(), proposed.rightToLeft())) {
            patch.setRightToLeft(proposed.rightToLeft());
        }

        if (mask.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new UpdateSheetProperties(patch, mask.toString()));
    }

    @Override
    public Request toRequest() {
        return new Request()
                .setUpdateSheetProperties(new UpdateSheetPropertiesRequest()
                        .setProperties(properties)
                        .setFields(fields));
    }

    private static com.google.api.services.sheets.v4.model.GridProperties diffGrid(
            FieldMask mask, GridProperties known, GridProperties wanted) {
        com.google.api.services.sheets.v4.model.GridProperties grid =
                new com.google.api.services.sheets.v4.model.GridProperties();
        boolean changed = false;
        if (mask.compare("gridProperties.rowCount", known.rowCount(), wanted.rowCount())) {
            grid.setRowCount(wanted.rowCount());
            changed = true;
        }
        if (mask.compare("gridProperties.columnCount", known.columnCount(), wanted.columnCount())) {
            grid.setColumnCount(wanted.columnCount());
            changed = true;
        }
        if (mask.compare("gridProperties.frozenRowCount", known.frozenRowCount(), wanted.frozenRowCount())) {
            grid.setFrozenRowCount(wanted.frozenRowCount());
            changed = true;
        }
        if (mask.compare("gridProperties.frozenColumnCount", known.frozenColumnCount(), wanted.frozenColumnCount())) {
            grid.setFrozenColumnCount(wanted.frozenColumnCount());
            changed = true;
        }
        if (mask.compare("gridProperties.hideGridlines", known.hideGridlines(), wanted.hideGridlines())) {
            grid.setHideGridlines(wanted.hideGridlines());
            changed = true;
        }
        return changed ? grid : null;
    }
}
