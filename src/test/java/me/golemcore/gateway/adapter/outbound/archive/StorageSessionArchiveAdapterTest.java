package me.golemcore.gateway.adapter.outbound.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.SessionRecord;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageSessionArchiveAdapterTest {

    @TempDir
    Path tempDir;

    private GatewayProperties properties;
    private ObjectMapper objectMapper;
    private StorageSessionArchiveAdapter archive;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        properties.getArchive().setEnabled(true);
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        archive = new StorageSessionArchiveAdapter(storage, objectMapper, properties);
    }

    @Test
    void shouldSaveAndLoadRecord() {
        SessionRecord sessionRecord = SessionRecord.builder()
                .id("s1")
                .model("sonnet")
                .status(SessionStatus.COMPLETED)
                .totalTurns(3)
                .totalCostUsd(0.25)
                .ownerHash("abc")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .updatedAt(Instant.parse("2026-01-01T00:05:00Z"))
                .build();

        archive.save(sessionRecord);

        assertTrue(Files.exists(tempDir.resolve("sessions").resolve("s1.json")));
        Optional<SessionRecord> loaded = archive.load("s1");
        assertTrue(loaded.isPresent());
        assertEquals(sessionRecord, loaded.get());
    }

    @Test
    void shouldReturnEmptyForMissingRecord() {
        assertFalse(archive.load("missing").isPresent());
    }

    @Test
    void shouldReturnEmptyForCorruptFile() throws IOException {
        Files.writeString(tempDir.resolve("sessions").resolve("bad.json"), "{not json");

        assertFalse(archive.load("bad").isPresent());
    }

    @Test
    void shouldDeleteRecord() {
        archive.save(SessionRecord.builder().id("s2").model("sonnet").build());

        archive.delete("s2");

        assertFalse(archive.load("s2").isPresent());
    }

    @Test
    void shouldReturnEmptyWhenStorageFails() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk gone"))));
        StorageSessionArchiveAdapter failingArchive = new StorageSessionArchiveAdapter(failing, objectMapper,
                properties);

        assertFalse(failingArchive.load("s1").isPresent());
    }
}
