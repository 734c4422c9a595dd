package com.vaultwave.backend.storage;

import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

public interface StorageService {

    /** Write bytes under a caller-chosen key such as "downloads/job-42/Title_MP3_320.zip". Existing content is replaced. */
    void store(String key, InputStream in) throws IOException;

    /** Open a stream over the object. Caller closes it. */
    InputStream open(String key) throws IOException;

    /** Spring resource for streaming the object back over HTTP. */
    Resource load(String key) throws IOException;

    /** Delete by key. Missing keys are ignored. */
    default void delete(String key) throws IOException {}
}
