package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.exception.StorageException;
import com.example.vrudetect_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path rawDir;

    public LocalStorageService(Path baseDir, String rawPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.rawDir = this.baseDir.resolve(rawPrefix).normalize();

        try {
            Files.createDirectories(rawDir);
            LOGGER.info("LocalStorageService ready. base={}, raw={}", this.baseDir, this.rawDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveRaw(String objectKey) {
        return safeResolve(rawDir, objectKey);
    }

    @Override
    public boolean existsInRaw(String objectKey) {
        return Files.isRegularFile(safeResolve(rawDir, objectKey));
    }

    @Override
    public Path rootRaw() {
        return rawDir;
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }
}
