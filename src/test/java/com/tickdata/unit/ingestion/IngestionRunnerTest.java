package com.tickdata.unit.ingestion;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.tickdata.ingestion.IngestionRunner;
import com.tickdata.ingestion.TickIngestionService;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class IngestionRunnerTest {

    @Mock
    private TickIngestionService tickIngestionService;

    private IngestionRunner ingestionRunner;

    @BeforeEach
    void setUp() {
        ingestionRunner = new IngestionRunner(tickIngestionService);
    }

    @Test
    @DisplayName("does nothing without --ingest")
    void noOption() throws Exception {
        ingestionRunner.run(new DefaultApplicationArguments("--server.port=8080"));

        verifyNoInteractions(tickIngestionService);
    }

    @Test
    @DisplayName("ingests every date given with --ingest")
    void ingestsDates() throws Exception {
        ingestionRunner.run(new DefaultApplicationArguments("--ingest=2022-04-04", "--ingest=2022-04-05"));

        verify(tickIngestionService).ingest(LocalDate.of(2022, 4, 4));
        verify(tickIngestionService).ingest(LocalDate.of(2022, 4, 5));
    }

    @Test
    @DisplayName("rejects a malformed date")
    void malformedDate() {
        assertThatThrownBy(() -> ingestionRunner.run(new DefaultApplicationArguments("--ingest=04-04-2022")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("04-04-2022");
        verifyNoInteractions(tickIngestionService);
    }
}
