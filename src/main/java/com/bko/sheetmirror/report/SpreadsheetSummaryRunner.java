package com.bko.sheetmirror.report;

import com.bko.sheetmirror.model.GridProperties;
import com.bko.sheetmirror.model.Sheet;
import com.bko.sheetmirror.model.Spreadsheet;
import com.bko.sheetmirror.shared.AppSettings;
import com.bko.sheetmirror.sync.SpreadsheetSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@ConditionalOnProperty(prefix = "sheetmirror.summary", name = "enabled", havingValue = "true")
public class SpreadsheetSummaryRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetSummaryRunner.class);

    private final SpreadsheetSynchronizer synchronizer;
    private final AppSettings settings;

    public SpreadsheetSummaryRunner(SpreadsheetSynchronizer synchronizer, AppSettings settings) {
        this.synchronizer = synchronizer;
        this.settings = settings;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!settings.isGoogleConfigured() || !settings.google().hasSpreadsheetId()) {
            logger.warn("Missing Google configuration. Check GOOGLE_SPREADSHEET_ID and GOOGLE_SERVICE_ACCOUNT_KEY_PATH.");
            return;
        }
        Spreadsheet spreadsheet = synchronizer.fetch(settings.google().spreadsheetId());
        logger.info("Spreadsheet '{}' ({})", spreadsheet.getTitle(), spreadsheet.getId());
        for (Sheet sheet : spreadsheet.getSheets()) {
            GridProperties grid = sheet.getGridProperties();
            logger.info("  [{}] '{}' id={} {}x{}{}", sheet.getProperties().index(), sheet.getTitle(),
                    sheet.getSheetId(), grid.rowCount(), grid.columnCount(),
                    sheet.getProperties().hidden() ? " (hidden)" : "");
        }
    }
}
