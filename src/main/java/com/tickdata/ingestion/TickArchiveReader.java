package com.tickdata.ingestion;

import com.tickdata.domain.model.Tick;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the vendor's daily tick-by-tick archive.
 *
 * <p>Archive layout: {@code <tickDirectory>/STOCK_TICK_<ddMMyyyy>.zip}, one CSV entry per ticker.
 * Each CSV carries the columns {@code Ticker, Date, Time, LTP, BuyPrice, BuyQty, SellPrice,
 * SellQty, LTQ, OpenInterest} (located by header name), with {@code Date} as dd/MM/yyyy and
 * {@code Time} as HH:mm:ss. The exchange suffix (".NSE") is stripped from tickers.
 *
 * <p>Entries that are not CSV files are skipped. Rows without a parsable timestamp, ticker or
 * numeric fields are dropped and counted; the rest of the file is still delivered.
 */
@Component
public class TickArchiveReader {

    private static final Logger log = LoggerFactory.getLogger(TickArchiveReader.class);

    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ofPattern("ddMMyyyy");
    private static final DateTimeFormatter TICK_TIMESTAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    private final IngestionConfig ingestionConfig;

    public TickArchiveReader(IngestionConfig ingestionConfig) {
        this.ingestionConfig = ingestionConfig;
    }

    public Path archivePath(LocalDate tradeDate) {
        return Path.of(ingestionConfig.getTickDirectory(), "STOCK_TICK_" + tradeDate.format(ARCHIVE_DATE) + ".zip");
    }

    /**
     * Reads the archive of {@code tradeDate}, handing the ticks of each ticker file to {@code batchConsumer}.
     * A missing archive is logged and yields nothing.
     *
     * @return per-archive counters
     */
    public ArchiveReadResult read(LocalDate tradeDate, Consumer<List<Tick>> batchConsumer) throws IOException {
        Path archive = archivePath(tradeDate);
        if (!Files.exists(archive)) {
            log.warn("Tick archive {} does not exist", archive);
            return new ArchiveReadResult(0, 0, 0);
        }
        log.info("Reading tick archive {}", archive);
        try (InputStream in = Files.newInputStream(archive)) {
            return read(in, batchConsumer);
        }
    }

    /**
     * Reads a tick archive from a zip stream. The stream is not closed.
     */
    public ArchiveReadResult read(InputStream zipStream, Consumer<List<Tick>> batchConsumer) throws IOException {
        int files = 0;
        int ticks = 0;
        int rejected = 0;

        ZipInputStream zis = new ZipInputStream(zipStream);
        ZipEntry entry;
        while ((entry = zis.getNextEntry()) != null) {
            if (entry.isDirectory() || !entry.getName().endsWith(".csv")) {
                continue;
            }
            // Not closed: closing would close the zip stream before the next entry
            BufferedReader reader = new BufferedReader(new InputStreamReader(zis, StandardCharsets.UTF_8));
            FileResult result = readTickerFile(entry.getName(), reader);
            files++;
            ticks += result.ticks().size();
            rejected += result.rejected();
            if (!result.ticks().isEmpty()) {
                batchConsumer.accept(result.ticks());
            }
        }

        if (rejected > 0) {
            log.warn("Tick archive: dropped {} unparsable rows", rejected);
        }
        return new ArchiveReadResult(files, ticks, rejected);
    }

    private FileResult readTickerFile(String name, BufferedReader reader) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            return new FileResult(List.of(), 0);
        }
        CsvHeader header = CsvHeader.parse(headerLine);

        List<Tick> ticks = new ArrayList<>();
        int rejected = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            try {
                ticks.add(parseRow(header, CsvHeader.split(line)));
            } catch (DateTimeParseException | NumberFormatException | ArithmeticException | IllegalStateException e) {
                rejected++;
                log.debug("Skipping row in {}: {} ({})", name, line, e.getMessage());
            }
        }
        log.debug("Read {} ticks from {}", ticks.size(), name);
        return new FileResult(ticks, rejected);
    }

    private Tick parseRow(CsvHeader header, String[] cells) {
        String ticker = header.get(cells, "Ticker");
        String date = header.get(cells, "Date");
        String time = header.get(cells, "Time");
        if (ticker == null || date == null || time == null) {
            throw new IllegalStateException("missing ticker, date or time");
        }
        return Tick.builder()
                .timestamp(LocalDateTime.parse(date + " " + time, TICK_TIMESTAMP))
                .instrumentId(ticker.replace(ingestionConfig.getTickerSuffix(), ""))
                .lastPrice(header.getDecimal(cells, "LTP"))
                .buyPrice(header.getDecimal(cells, "BuyPrice"))
                .buyQty(header.getLong(cells, "BuyQty"))
                .sellPrice(header.getDecimal(cells, "SellPrice"))
                .sellQty(header.getLong(cells, "SellQty"))
                .lastQty(header.getLong(cells, "LTQ"))
                .openInterest(header.getLong(cells, "OpenInterest"))
                .build();
    }

    /** Counters for one archive: ticker files read, ticks delivered, rows rejected. */
    public record ArchiveReadResult(int files, int ticks, int rejectedRows) {}

    private record FileResult(List<Tick> ticks, int rejected) {}
}
