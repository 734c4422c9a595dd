package com.vaultwave.backend.storage;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;

@Service
@ConditionalOnProperty(name = "app.storage.provider", havingValue = "local", matchIfMissing = true)
public class LocalStorageService implements StorageService {

    private final Path rootDir;       // e.g. /var/app/uploads

    public LocalStorageService(@Value("${app.upload.root:uploads}") String uploadRoot) throws IOException {
        this.rootDir = Path.of(uploadRoot).toAbsolutePath().normalize();
        Files.createDirectories(this.rootDir);
    }

    @Override
    public void store(String key, InputStream in) throws IOException {
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public InputStream open(String key) throws IOException {
        Path p = resolve(key);
        if (!Files.exists(p)) throw new FileNotFoundException("No stored object for key: " + key);
        return Files.newInputStream(p);
    }

    @Override
    public Resource load(String key) throws IOException {
        Path p = resolve(key);
        if (!Files.exists(p)) throw new FileNotFoundException("No stored object for key: " + key);
        return new FileSystemResource(p);
    }

    @Override
    public void delete(String key) throws IOException {
        if (key == null || key.isBlank()) return;
        Files.deleteIfExists(resolve(key));
    }

    // Keys are relative; anything that normalises outside the root is refused
    private Path resolve(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("Storage key is empty");
        Path p = rootDir.resolve(key.replaceFirst("^/+", "")).normalize();
        if (!p.startsWith(rootDir)) throw new IllegalArgumentException("Storage key escapes the upload root: " + key);
        return p;
    }
}
