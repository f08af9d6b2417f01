package com.example.offshore.allocation.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.VoyageEventDocument;
import com.example.offshore.allocation.store.OperationalRecordStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Consumer;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecordBackupWriter")
class RecordBackupWriterTest {

    @TempDir
    Path tempDir;

    @Mock
    private OperationalRecordStore store;

    private RecordBackupWriter writer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-02-03T04:05:06.789Z"), ZoneOffset.UTC);
        writer = new RecordBackupWriter(new CamelCsvParserFactory(), new CompressionSupport(),
                tempDir.resolve("backups"), clock);
        when(store.kind()).thenReturn(RecordKind.VOYAGE_EVENT);
    }

    @SuppressWarnings("unchecked")
    private void storeContains(List<OperationalRecord> records) {
        doAnswer(invocation -> {
            Consumer<OperationalRecord> consumer = invocation.getArgument(1);
            records.forEach(consumer);
            return null;
        }).when(store).forEachRecord(anyInt(), any(Consumer.class));
    }

    @Test
    @DisplayName("Writes a timestamped gzip CSV with a header and one row per record")
    void writesCompressedSnapshot() throws IOException {
        // Given
        storeContains(List.of(
                VoyageEventDocument.builder().id("ve-1").vessel("Pelican").location("Mad Dog").hours(4.5).build(),
                VoyageEventDocument.builder().id("ve-2").vessel("Harvey, Supporter").remarks("line one\nline two").build()));

        // When
        Path backup = writer.writeBackup(store, 100);

        // Then
        assertThat(backup.getFileName().toString()).isEqualTo("voyage_events_backup_20240203T040506789.csv.gz");
        assertThat(writer.countRows(backup, backup.getFileName().toString())).isEqualTo(2);
        try (InputStream in = new GzipCompressorInputStream(Files.newInputStream(backup));
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            assertThat(reader.readLine()).startsWith("id,vessel,mission,voyageNumber,location");
            assertThat(reader.readLine()).startsWith("ve-1,Pelican,,,Mad Dog");
        }
    }

    @Test
    @DisplayName("An empty collection still produces a verifiable snapshot")
    void emptyCollection() {
        storeContains(List.of());

        Path backup = writer.writeBackup(store, 100);

        assertThat(backup).exists();
        assertThat(writer.countRows(backup, backup.getFileName().toString())).isZero();
    }

    @Test
    @DisplayName("A store failure while streaming becomes a BackupException")
    void storeFailure() {
        doThrow(new IllegalStateException("cursor killed")).when(store).forEachRecord(anyInt(), any());

        assertThatThrownBy(() -> writer.writeBackup(store, 100))
                .isInstanceOf(BackupException.class)
                .hasRootCauseMessage("cursor killed");
    }

    @Test
    @DisplayName("An unusable backup directory becomes a BackupException")
    void unusableDirectory() throws IOException {
        Path occupied = Files.writeString(tempDir.resolve("occupied"), "x");
        RecordBackupWriter blocked = new RecordBackupWriter(new CamelCsvParserFactory(), new CompressionSupport(),
                occupied, Clock.systemUTC());

        assertThatThrownBy(() -> blocked.writeBackup(store, 100))
                .isInstanceOf(BackupException.class)
                .hasMessageContaining("Failed to write backup");
    }
}
