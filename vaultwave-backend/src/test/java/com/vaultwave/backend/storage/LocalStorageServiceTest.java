package com.vaultwave.backend.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageServiceTest {

    @TempDir
    Path root;

    @Test
    void storesOpensAndDeletesByKey() throws Exception {
        LocalStorageService storage = new LocalStorageService(root.toString());
        storage.store("downloads/job-1/Release_WAV.zip", new ByteArrayInputStream("zip".getBytes(StandardCharsets.UTF_8)));

        assertTrue(Files.exists(root.resolve("downloads/job-1/Release_WAV.zip")));
        try (InputStream in = storage.open("downloads/job-1/Release_WAV.zip")) {
            assertEquals("zip", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(3, storage.load("downloads/job-1/Release_WAV.zip").contentLength());

        storage.delete("downloads/job-1/Release_WAV.zip");
        storage.delete("downloads/job-1/Release_WAV.zip");
        assertThrows(FileNotFoundException.class, () -> storage.load("downloads/job-1/Release_WAV.zip"));
    }

    @Test
    void keysCannotEscapeTheRoot() throws Exception {
        LocalStorageService storage = new LocalStorageService(root.resolve("uploads").toString());

        assertThrows(IllegalArgumentException.class,
                () -> storage.store("../outside.txt", new ByteArrayInputStream(new byte[0])));
        assertThrows(IllegalArgumentException.class, () -> storage.open(" "));
    }
}
