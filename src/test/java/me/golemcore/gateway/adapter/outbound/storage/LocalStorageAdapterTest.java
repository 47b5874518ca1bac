package me.golemcore.gateway.adapter.outbound.storage;

import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    private static final String DIR = "sessions";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateArchiveDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(DIR)));
    }

    @Test
    void shouldWriteAtomicallyAndReadBack() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(DIR, "s1.json", "{\"id\":\"s1\"}").get();
        storageAdapter.putTextAtomic(DIR, "s1.json", "{\"id\":\"s1\",\"totalTurns\":2}").get();

        assertEquals("{\"id\":\"s1\",\"totalTurns\":2}", storageAdapter.getText(DIR, "s1.json").get());
        assertFalse(Files.exists(tempDir.resolve(DIR).resolve("s1.json.tmp")));
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(DIR, "missing.json").get());
    }

    @Test
    void shouldDeleteFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(DIR, "s1.json", "{}").get();

        storageAdapter.deleteObject(DIR, "s1.json").get();

        assertFalse(Files.exists(tempDir.resolve(DIR).resolve("s1.json")));
        assertNull(storageAdapter.getText(DIR, "s1.json").get());
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(DIR, "../../etc/passwd").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
