package com.tickdata.event;

import com.tickdata.domain.model.MismatchReport;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every bhavcopy reconciliation run.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ReconciliationAlertHandler: logs a warning per mismatch category</li>
 * </ul>
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final LocalDate tradeDate;
    private final MismatchReport report;
    private final LocalDateTime reconciledAt;

    /**
     * @param source    the component publishing this event
     * @param tradeDate the reconciled trade date
     * @param report    the reconciliation outcome
     */
    public ReconciliationEvent(Object source, LocalDate tradeDate, MismatchReport report) {
        super(source);
        this.tradeDate = tradeDate;
        this.report = report;
        this.reconciledAt = LocalDateTime.now();
    }

    public LocalDate getTradeDate() {
        return tradeDate;
    }

    public MismatchReport getReport() {
        return report;
    }

    public LocalDateTime getReconciledAt() {
        return reconciledAt;
    }
}
