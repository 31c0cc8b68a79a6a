package com.example.vrudetect_backend.service.Interfaces;

import java.nio.file.Path;

/**
 * Read-only view of the upload store. Uploads themselves are handled outside this service.
 */
public interface StorageService {
    /** Volledige lokale pad-resolutie voor ffmpeg/ffprobe. */
    Path resolveRaw(String objectKey);

    boolean existsInRaw(String objectKey);

    Path rootRaw();
}
