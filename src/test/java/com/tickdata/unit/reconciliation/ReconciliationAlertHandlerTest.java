package com.tickdata.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThatCode;

import com.tickdata.domain.enums.MismatchType;
import com.tickdata.domain.model.MismatchReport;
import com.tickdata.domain.model.MismatchRow;
import com.tickdata.domain.model.MismatchTable;
import com.tickdata.event.ReconciliationEvent;
import com.tickdata.reconciliation.ReconciliationAlertHandler;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReconciliationAlertHandlerTest {

    private static final LocalDate TRADE_DATE = LocalDate.of(2022, 4, 4);

    private final ReconciliationAlertHandler handler = new ReconciliationAlertHandler();

    @Test
    @DisplayName("logs a volume mismatch and unmapped rows without failing")
    void reportWithMismatches() {
        MismatchTable volume = MismatchTable.of(
                MismatchType.VOLUME, List.of(new MismatchRow(TRADE_DATE.atStartOfDay(), "TCS", 10L, null)));
        MismatchReport report = MismatchReport.builder()
                .rowCountDifference(1)
                .unmappedReferenceRows(2)
                .volumeMismatch(volume)
                .build();

        assertThatCode(() -> handler.onReconciliation(new ReconciliationEvent(this, TRADE_DATE, report)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("handles a clean report")
    void cleanReport() {
        MismatchReport report = MismatchReport.builder().build();

        assertThatCode(() -> handler.onReconciliation(new ReconciliationEvent(this, TRADE_DATE, report)))
                .doesNotThrowAnyException();
    }
}
