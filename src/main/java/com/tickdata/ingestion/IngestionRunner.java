package com.tickdata.ingestion;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Ingests tick archives named on the command line, e.g. {@code --ingest=2022-04-04}.
 * The option may be repeated; without it the runner does nothing.
 */
@Component
public class IngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    static final String INGEST_OPTION = "ingest";

    private final TickIngestionService tickIngestionService;

    public IngestionRunner(TickIngestionService tickIngestionService) {
        this.tickIngestionService = tickIngestionService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption(INGEST_OPTION)) {
            return;
        }
        List<String> dates = args.getOptionValues(INGEST_OPTION);
        for (String value : dates) {
            LocalDate tradeDate;
            try {
                tradeDate = LocalDate.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                        "Invalid --ingest date '" + value + "', expected YYYY-MM-DD", e);
            }
            log.info("Ingesting ticks for {} from command line", tradeDate);
            tickIngestionService.ingest(tradeDate);
        }
    }
}
