package com.eyelevel.bulkconverter.service.ledger;

import com.eyelevel.bulkconverter.config.ConversionProperties;
import com.eyelevel.bulkconverter.exception.BulkConversionException;
import com.eyelevel.bulkconverter.model.ErrorKind;
import com.eyelevel.bulkconverter.model.FailureRecord;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable, append-only record of every work item that did not succeed, kept as a CSV file with a header row:
 * {@code timestamp,filename,file_size_bytes,error_type,error_message,attempt_count}.
 * <p>
 * Every operation takes the same lock, so concurrent appends are never interleaved and queries, exports and
 * prunes always see whole rows. Rows are never edited in place; a retried and still failing item gets a new
 * row with a higher attempt count.
 */
@Slf4j
@Service
public class FailureLedger {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(LedgerRow.class).withHeader();
    private static final ObjectWriter ROW_WRITER = CSV_MAPPER.writerFor(LedgerRow.class)
                                                             .with(SCHEMA.withoutHeader());
    private static final ObjectWriter HEADER_WRITER = CSV_MAPPER.writerFor(LedgerRow.class).with(SCHEMA);
    // Rows with extra or missing trailing columns still map.
    private static final ObjectReader ROW_READER = CSV_MAPPER.readerFor(LedgerRow.class)
                                                             .with(SCHEMA)
                                                             .with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                                                             .with(CsvParser.Feature.ALLOW_TRAILING_COMMA)
                                                             .with(CsvParser.Feature.SKIP_EMPTY_LINES);

    private final Path ledgerPath;
    private final Duration recentWindow;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public FailureLedger(final ConversionProperties properties) {
        this(properties.ledger().path(), properties.ledger().recentWindow(), Clock.systemDefaultZone());
    }

    public FailureLedger(final Path ledgerPath, final Duration recentWindow, final Clock clock) {
        this.ledgerPath = ledgerPath;
        this.recentWindow = recentWindow;
        this.clock = clock;
        log.info("FailureLedger initialized at '{}'.", ledgerPath.toAbsolutePath());
    }

    public Path getLedgerPath() {
        return ledgerPath;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public void append(final FailureRecord record) {
        appendAll(List.of(record));
    }

    /**
     * Appends the records in the given order as one write.
     */
    public void appendAll(final List<FailureRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        final List<LedgerRow> rows = records.stream().map(FailureLedger::toRow).toList();
        lock.lock();
        try {
            ensureLedgerExists();
            final byte[] bytes = ROW_WRITER.writeValueAsBytes(rows);
            try (FileChannel channel = FileChannel.open(ledgerPath, StandardOpenOption.WRITE,
                                                        StandardOpenOption.APPEND)) {
                channel.write(ByteBuffer.wrap(bytes));
                channel.force(false);
            }
            log.debug("Appended {} failure record(s) to the ledger.", rows.size());
        } catch (IOException e) {
            throw new BulkConversionException("Failed to append to failure ledger " + ledgerPath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The parseable rows matching {@code query}, in append order.
     */
    public List<FailureRecord> query(final FailureQuery query) {
        final LocalDateTime now = now();
        return readRecords().stream().filter(record -> query.matches(record, now)).toList();
    }

    /**
     * Counts the existing rows per identifier, used to number the next attempt of a failing item.
     */
    public Map<String, Integer> attemptCounts(final Collection<String> identifiers) {
        final Map<String, Integer> counts = new HashMap<>();
        final Set<String> wanted = new HashSet<>(identifiers);
        for (LedgerRow row : readRows().rows()) {
            if (wanted.contains(row.getFilename())) {
                counts.merge(row.getFilename(), 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Removes rows older than {@code olderThan}. Rows whose timestamp cannot be parsed are removed too.
     * The file is rewritten to a sibling and moved into place, so unaffected rows are never truncated.
     *
     * @return The number of removed rows.
     */
    public int prune(final Duration olderThan) {
        final LocalDateTime cutoff = now().minus(olderThan);
        lock.lock();
        try {
            final LedgerContents contents = readRows();
            final List<LedgerRow> rows = contents.rows();
            final List<LedgerRow> kept = rows.stream()
                                             .filter(row -> parseTimestamp(row).map(ts -> !ts.isBefore(cutoff))
                                                                               .orElse(false))
                                             .toList();
            final int removed = rows.size() - kept.size() + contents.unreadable();
            if (removed == 0) {
                log.info("Ledger prune found no rows older than {}.", cutoff);
                return 0;
            }
            final Path tempFile = ledgerPath.resolveSibling(ledgerPath.getFileName() + ".tmp");
            if (kept.isEmpty()) {
                Files.writeString(tempFile, headerLine(), StandardCharsets.UTF_8);
            } else {
                Files.write(tempFile, HEADER_WRITER.writeValueAsBytes(kept));
            }
            Files.move(tempFile, ledgerPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Pruned {} ledger row(s) older than {}. {} row(s) kept.", removed, cutoff, kept.size());
            return removed;
        } catch (IOException e) {
            throw new BulkConversionException("Failed to prune failure ledger " + ledgerPath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the rows matching {@code query} as CSV, with header, to {@code out}.
     *
     * @return The number of exported rows.
     */
    public int export(final FailureQuery query, final OutputStream out) throws IOException {
        final List<LedgerRow> rows = query(query).stream().map(FailureLedger::toRow).toList();
        if (rows.isEmpty()) {
            out.write(headerLine().getBytes(StandardCharsets.UTF_8));
        } else {
            out.write(HEADER_WRITER.writeValueAsBytes(rows));
        }
        return rows.size();
    }

    public FailureSummary summarize() {
        final List<LedgerRow> rows = readRows().rows();
        final LocalDateTime recentCutoff = now().minus(recentWindow);
        final Map<String, Long> byKind = rows.stream().collect(
                Collectors.groupingBy(row -> String.valueOf(row.getErrorType()), TreeMap::new, Collectors.counting()));
        final long uniqueFiles = rows.stream().map(LedgerRow::getFilename).distinct().count();
        final long recent = rows.stream()
                                .map(FailureLedger::parseTimestamp)
                                .filter(ts -> ts.map(value -> !value.isBefore(recentCutoff)).orElse(false))
                                .count();
        return new FailureSummary(rows.size(), (int) uniqueFiles, byKind, recent, recentWindow);
    }

    private List<FailureRecord> readRecords() {
        final List<FailureRecord> records = new ArrayList<>();
        for (LedgerRow row : readRows().rows()) {
            toRecord(row).ifPresentOrElse(records::add,
                                          () -> log.warn("Skipping unreadable ledger row for '{}'.", row.getFilename()));
        }
        return records;
    }

    /**
     * Reads every row that can be mapped. A row the CSV parser rejects is logged, counted and skipped; reading
     * stops only when the parser can no longer advance past a broken row.
     */
    private LedgerContents readRows() {
        lock.lock();
        try {
            if (!Files.exists(ledgerPath) || Files.size(ledgerPath) == 0) {
                return new LedgerContents(List.of(), 0);
            }
            final List<LedgerRow> rows = new ArrayList<>();
            int unreadable = 0;
            long lastFailureOffset = -1;
            try (MappingIterator<LedgerRow> iterator = ROW_READER.readValues(ledgerPath.toFile())) {
                while (true) {
                    try {
                        if (!iterator.hasNextValue()) {
                            break;
                        }
                        rows.add(iterator.nextValue());
                    } catch (JsonProcessingException | RuntimeJsonMappingException e) {
                        final JsonLocation location = iterator.getCurrentLocation();
                        final long offset = location == null ? -1 : location.getCharOffset();
                        if (offset == lastFailureOffset) {
                            log.warn("Failure ledger '{}' cannot be read past offset {}; remaining content ignored.",
                                     ledgerPath, offset);
                            break;
                        }
                        lastFailureOffset = offset;
                        unreadable++;
                        log.warn("Skipping malformed failure ledger row near line {}: {}",
                                 location == null ? "?" : location.getLineNr(), e.getMessage());
                    }
                }
            }
            return new LedgerContents(rows, unreadable);
        } catch (IOException e) {
            throw new BulkConversionException("Failed to read failure ledger " + ledgerPath, e);
        } finally {
            lock.unlock();
        }
    }

    private record LedgerContents(List<LedgerRow> rows, int unreadable) {
    }

    private void ensureLedgerExists() throws IOException {
        if (Files.exists(ledgerPath) && Files.size(ledgerPath) > 0) {
            return;
        }
        final Path parent = ledgerPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(ledgerPath, headerLine(), StandardCharsets.UTF_8);
        log.info("Created failure ledger with header at '{}'.", ledgerPath.toAbsolutePath());
    }

    private static String headerLine() {
        final List<String> columns = new ArrayList<>();
        SCHEMA.forEach(column -> columns.add(column.getName()));
        return String.join(",", columns) + "\n";
    }

    private static LedgerRow toRow(final FailureRecord record) {
        return new LedgerRow(record.timestamp().toString(), record.identifier(), String.valueOf(record.sizeBytes()),
                             record.errorKind().name(), record.message(), String.valueOf(record.attemptCount()));
    }

    private static Optional<FailureRecord> toRecord(final LedgerRow row) {
        final Optional<LocalDateTime> timestamp = parseTimestamp(row);
        final Optional<ErrorKind> kind = parse(row.getErrorType(), ErrorKind::valueOf);
        if (timestamp.isEmpty() || kind.isEmpty()) {
            return Optional.empty();
        }
        final long size = parse(row.getFileSizeBytes(), Long::parseLong).orElse(0L);
        final int attempts = parse(row.getAttemptCount(), Integer::parseInt).orElse(1);
        return Optional.of(new FailureRecord(timestamp.get(), row.getFilename(), size, kind.get(),
                                             row.getErrorMessage(), attempts));
    }

    private static Optional<LocalDateTime> parseTimestamp(final LedgerRow row) {
        try {
            return Optional.ofNullable(row.getTimestamp()).map(String::strip).map(LocalDateTime::parse);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static <T> Optional<T> parse(final String value, final Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(value.strip()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
