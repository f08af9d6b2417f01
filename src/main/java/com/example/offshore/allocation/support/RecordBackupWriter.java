package com.example.offshore.allocation.support;

import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.VesselManifestDocument;
import com.example.offshore.allocation.model.VoyageEventDocument;
import com.example.offshore.allocation.store.OperationalRecordStore;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes a gzip CSV snapshot of a whole record collection and reads it back to confirm every row landed.
 * A snapshot that cannot be written or verified is a {@link BackupException}.
 */
@Slf4j
@Component
public class RecordBackupWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS")
            .withZone(ZoneOffset.UTC);

    private final CamelCsvParserFactory csvFactory;
    private final CompressionSupport compressionSupport;
    private final Path backupDir;
    private final Clock clock;

    @Autowired
    public RecordBackupWriter(CamelCsvParserFactory csvFactory,
            CompressionSupport compressionSupport,
            @Value("${app.backfill.backup-dir:backups}") String backupDir,
            Clock clock) {
        this(csvFactory, compressionSupport, Paths.get(backupDir), clock);
    }

    public RecordBackupWriter(CamelCsvParserFactory csvFactory,
            CompressionSupport compressionSupport,
            Path backupDir,
            Clock clock) {
        this.csvFactory = csvFactory;
        this.compressionSupport = compressionSupport;
        this.backupDir = backupDir;
        this.clock = clock;
    }

    public Path writeBackup(OperationalRecordStore store, int pageSize) {
        RecordKind kind = store.kind();
        Path target = backupDir.resolve("%s_backup_%s.csv.gz".formatted(kind.collectionName(), TIMESTAMP.format(clock.instant())));
        String filename = target.getFileName().toString();

        long written;
        try {
            Files.createDirectories(backupDir);
            written = writeRows(store, pageSize, target, filename);
        } catch (IOException ex) {
            throw new BackupException("Failed to write backup %s".formatted(target), ex);
        } catch (RuntimeException ex) {
            throw new BackupException("Failed to stream %s records into backup %s".formatted(kind.collectionName(), target), ex);
        }

        long verified = countRows(target, filename);
        if (verified != written) {
            throw new BackupException("Backup %s holds %d rows but %d records were written".formatted(target, verified, written));
        }
        log.info("Backup created file={} records={}", target, written);
        return target;
    }

    /**
     * Counts data rows in a snapshot, excluding the header.
     */
    public long countRows(Path backupFile, String filename) {
        CsvParser parser = csvFactory.newParser();
        try (InputStream raw = Files.newInputStream(backupFile);
                InputStream decoded = compressionSupport.decodeIfNecessary(raw, filename);
                Reader reader = new InputStreamReader(decoded, StandardCharsets.UTF_8)) {
            parser.beginParsing(reader);
            long rows = 0;
            boolean headerSkipped = false;
            while (parser.parseNext() != null) {
                if (!headerSkipped) {
                    headerSkipped = true;
                    continue;
                }
                rows++;
            }
            return rows;
        } catch (IOException ex) {
            throw new BackupException("Failed to verify backup %s".formatted(backupFile), ex);
        } finally {
            parser.stopParsing();
        }
    }

    private long writeRows(OperationalRecordStore store, int pageSize, Path target, String filename) throws IOException {
        AtomicLong rows = new AtomicLong();
        try (OutputStream raw = Files.newOutputStream(target);
                OutputStream encoded = compressionSupport.encodeIfNecessary(raw, filename);
                OutputStreamWriter writer = new OutputStreamWriter(encoded, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = csvFactory.newWriter(writer);
            csvWriter.writeHeaders(headersFor(store.kind()));
            store.forEachRecord(pageSize, record -> {
                csvWriter.writeRow((Object[]) record.toBackupRow());
                if (rows.incrementAndGet() % pageSize == 0) {
                    log.info("Backed up {} {} records", rows.get(), store.kind().collectionName());
                }
            });
            csvWriter.flush();
        }
        return rows.get();
    }

    private static String[] headersFor(RecordKind kind) {
        return switch (kind) {
            case VOYAGE_EVENT -> VoyageEventDocument.BACKUP_HEADERS;
            case MANIFEST_LINE -> VesselManifestDocument.BACKUP_HEADERS;
        };
    }
}
