package com.tickdata.ingestion;

import com.tickdata.domain.model.ReferenceBar;
import com.tickdata.exception.ReconciliationSourceUnavailableException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the exchange's end-of-day snapshot ("bhavcopy") used as reconciliation reference.
 *
 * <p>Archive layout: {@code <bhavcopyDirectory>/EODSNAPSHOT_<DDMMMYYYY>bhav.csv.zip}, e.g.
 * {@code EODSNAPSHOT_04APR2022bhav.csv.zip}. Only the first zip entry is read. Its header is
 * matched case-insensitively; the columns used are SYMBOL, SERIES, OPEN, HIGH, LOW, CLOSE,
 * TOTTRDQTY and TIMESTAMP (dd-MMM-yyyy).
 *
 * <p>Cells that cannot be parsed become null rather than dropping the row, so that every
 * reference row still counts and shows up in the reconciliation.
 */
@Component
public class BhavcopyArchiveReader {

    private static final Logger log = LoggerFactory.getLogger(BhavcopyArchiveReader.class);

    private static final String SOURCE = "bhavcopy";

    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ofPattern("ddMMMyyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TRADE_DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("dd-MMM-yyyy")
            .toFormatter(Locale.ENGLISH);

    private final IngestionConfig ingestionConfig;

    public BhavcopyArchiveReader(IngestionConfig ingestionConfig) {
        this.ingestionConfig = ingestionConfig;
    }

    public Path archivePath(LocalDate tradeDate) {
        String date = tradeDate.format(ARCHIVE_DATE).toUpperCase(Locale.ROOT);
        return Path.of(ingestionConfig.getBhavcopyDirectory(), "EODSNAPSHOT_" + date + "bhav.csv.zip");
    }

    /**
     * Loads the reference rows of {@code tradeDate}.
     *
     * @throws ReconciliationSourceUnavailableException if the archive is missing, empty or unreadable
     */
    public List<ReferenceBar> read(LocalDate tradeDate) {
        Path archive = archivePath(tradeDate);
        if (!Files.exists(archive)) {
            throw new ReconciliationSourceUnavailableException(
                    SOURCE, tradeDate, "Bhavcopy archive not found: " + archive.getFileName());
        }
        try (InputStream in = Files.newInputStream(archive)) {
            List<ReferenceBar> rows = read(in)
                    .orElseThrow(() -> new ReconciliationSourceUnavailableException(
                            SOURCE, tradeDate, "Bhavcopy archive is empty: " + archive.getFileName()));
            log.info("Loaded {} bhavcopy rows from {}", rows.size(), archive.getFileName());
            return rows;
        } catch (IOException e) {
            throw new ReconciliationSourceUnavailableException(
                    SOURCE, tradeDate, "Failed to read bhavcopy archive " + archive.getFileName(), e);
        }
    }

    /**
     * Parses the first CSV entry of a bhavcopy zip stream. The stream is not closed.
     *
     * @return the rows, or empty if the zip has no entries
     */
    public Optional<List<ReferenceBar>> read(InputStream zipStream) throws IOException {
        ZipInputStream zis = new ZipInputStream(zipStream);
        ZipEntry entry = zis.getNextEntry();
        if (entry == null) {
            return Optional.empty();
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(zis, StandardCharsets.UTF_8));
        String headerLine = reader.readLine();
        if (headerLine == null) {
            return Optional.of(List.of());
        }
        CsvHeader header = CsvHeader.parse(headerLine);

        List<ReferenceBar> rows = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                rows.add(parseRow(header, CsvHeader.split(line)));
            }
        }
        return Optional.of(rows);
    }

    private ReferenceBar parseRow(CsvHeader header, String[] cells) {
        return ReferenceBar.builder()
                .symbol(header.get(cells, "SYMBOL"))
                .series(header.get(cells, "SERIES"))
                .tradeDate(parseDate(header.get(cells, "TIMESTAMP")))
                .open(parseDouble(header.get(cells, "OPEN")))
                .high(parseDouble(header.get(cells, "HIGH")))
                .low(parseDouble(header.get(cells, "LOW")))
                .close(parseDouble(header.get(cells, "CLOSE")))
                .volume(parseLong(header.get(cells, "TOTTRDQTY")))
                .build();
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value, TRADE_DATE);
        } catch (DateTimeParseException e) {
            log.warn("Unparsable bhavcopy TIMESTAMP '{}'", value);
            return null;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.warn("Unparsable bhavcopy price '{}'", value);
            return null;
        }
    }

    private static Long parseLong(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("Unparsable bhavcopy quantity '{}'", value);
            return null;
        }
    }
}
