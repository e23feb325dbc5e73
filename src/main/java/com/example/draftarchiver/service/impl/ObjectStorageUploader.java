package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.ArchiveArtifact;
import com.example.draftarchiver.domain.UploadReceipt;
import com.example.draftarchiver.exceptions.LifecycleCancelledException;
import com.example.draftarchiver.exceptions.ObjectStorageException;
import com.example.draftarchiver.exceptions.UploadException;
import com.example.draftarchiver.service.ObjectStorageClient;
import com.example.draftarchiver.service.Uploader;
import com.example.draftarchiver.service.support.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class ObjectStorageUploader implements Uploader {

    private static final Logger log = LoggerFactory.getLogger(ObjectStorageUploader.class);
    private static final String CONTENT_TYPE = "application/zip";

    private final ObjectStorageClient storageClient;
    private final BackoffPolicy backoffPolicy;
    private final String keyPrefix;
    private final boolean verify;
    private final Clock clock;

    @Autowired
    public ObjectStorageUploader(ObjectStorageClient storageClient,
                                 @Value("${draft.upload.max-attempts:3}") int maxAttempts,
                                 @Value("${draft.upload.initial-backoff-ms:1000}") long initialBackoffMs,
                                 @Value("${draft.upload.max-backoff-ms:8000}") long maxBackoffMs,
                                 @Value("${draft.upload.key-prefix:draft_archives}") String keyPrefix,
                                 @Value("${draft.upload.verify:false}") boolean verify) {
        this(storageClient, new BackoffPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs)),
                keyPrefix, verify, Clock.systemUTC());
    }

    ObjectStorageUploader(ObjectStorageClient storageClient, BackoffPolicy backoffPolicy,
                          String keyPrefix, boolean verify, Clock clock) {
        this.storageClient = storageClient;
        this.backoffPolicy = backoffPolicy;
        this.keyPrefix = normalizePrefix(keyPrefix);
        this.verify = verify;
        this.clock = clock;
    }

    @Override
    public UploadReceipt upload(ArchiveArtifact artifact, String draftId) {
        String key = objectKeyFor(draftId);
        ObjectStorageException lastFailure = null;
        int attempts = 0;

        while (backoffPolicy.hasAttemptsLeft(attempts)) {
            if (attempts > 0) {
                log.info("[Upload][draft:{}] Retrying upload of {} (attempt {}/{})", draftId, key, attempts + 1, backoffPolicy.getMaxAttempts());
                try {
                    backoffPolicy.sleepBeforeRetry(attempts);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LifecycleCancelledException("Upload of " + key + " was interrupted.", e);
                }
            }
            attempts++;

            try (InputStream in = Files.newInputStream(artifact.path())) {
                String url = storageClient.put(key, in, artifact.sizeBytes(), CONTENT_TYPE);
                if (verify && !storageClient.exists(key)) {
                    throw new ObjectStorageException("Object " + key + " not visible after upload", null, true);
                }
                log.info("[Upload][draft:{}] Uploaded {} bytes to {}", draftId, artifact.sizeBytes(), key);
                return new UploadReceipt(draftId, key, url, artifact.sizeBytes(), Instant.now(clock));

            } catch (ObjectStorageException e) {
                lastFailure = e;
                if (!e.isTransientFailure()) {
                    log.error("[Upload][draft:{}] Permanent failure uploading {}: {}", draftId, key, e.getMessage());
                    throw new UploadException("Upload of " + key + " failed permanently: " + e.getMessage(), e, false, attempts);
                }
                log.warn("[Upload][draft:{}] Attempt {}/{} for {} failed: {}", draftId, attempts, backoffPolicy.getMaxAttempts(), key, e.getMessage());

            } catch (IOException e) {
                // the local artifact is unreadable; another attempt cannot fix that
                throw new UploadException("Cannot read archive " + artifact.path() + " for upload", e, false, attempts);
            }
        }

        log.error("[Upload][draft:{}] Giving up on {} after {} attempt(s)", draftId, key, attempts);
        throw new UploadException("Upload of " + key + " failed after " + attempts + " attempt(s)", lastFailure, true, attempts);
    }

    @Override
    public String objectKeyFor(String draftId) {
        return keyPrefix.isEmpty() ? draftId + ".zip" : keyPrefix + "/" + draftId + ".zip";
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null) {
            return "";
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
