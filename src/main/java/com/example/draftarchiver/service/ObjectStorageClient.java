package com.example.draftarchiver.service;

import com.example.draftarchiver.exceptions.ObjectStorageException;

import java.io.InputStream;

/**
 * Minimal durable object storage contract. Every operation is idempotent.
 */
public interface ObjectStorageClient {

    /**
     * Stores an object, replacing any existing object under the same key.
     *
     * @return The URL under which the object can be retrieved.
     * @throws ObjectStorageException If the transfer fails.
     */
    String put(String key, InputStream content, long size, String contentType);

    /**
     * @throws ObjectStorageException If the lookup itself fails.
     */
    boolean exists(String key);

    /**
     * Removes the object under the key. Removing a missing object succeeds.
     *
     * @throws ObjectStorageException If the removal fails.
     */
    void delete(String key);

    String urlFor(String key);
}
