package com.tickdata.reconciliation;

import com.tickdata.domain.model.MismatchReport;
import com.tickdata.domain.model.MismatchTable;
import com.tickdata.event.ReconciliationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns reconciliation results into operator-facing log alerts.
 *
 * <p>One warning per mismatch category, naming the first offending instrument so the log line is
 * actionable without fetching the full report. Unmapped reference rows get their own warning.
 */
@Component
public class ReconciliationAlertHandler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationAlertHandler.class);

    @EventListener
    public void onReconciliation(ReconciliationEvent event) {
        MismatchReport report = event.getReport();

        alert(event, report.getVolumeMismatch());
        alert(event, report.getHighMismatch());
        alert(event, report.getLowMismatch());

        if (report.getUnmappedReferenceRows() > 0) {
            log.warn(
                    "Bhavcopy {}: {} reference rows had no usable symbol/series and were skipped",
                    event.getTradeDate(),
                    report.getUnmappedReferenceRows());
        }
    }

    private void alert(ReconciliationEvent event, MismatchTable table) {
        if (table == null) {
            return;
        }
        log.warn(
                "Bhavcopy {}: {} {} mismatches (first: {})",
                event.getTradeDate(),
                table.size(),
                table.getType(),
                table.getRows().get(0).instrumentId());
    }
}
