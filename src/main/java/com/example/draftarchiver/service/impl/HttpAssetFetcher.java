package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.AssetTask;
import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.exceptions.AssetFetchException;
import com.example.draftarchiver.exceptions.AssetIntegrityException;
import com.example.draftarchiver.exceptions.LifecycleCancelledException;
import com.example.draftarchiver.service.AssetFetcher;
import com.example.draftarchiver.service.support.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;

@Service
public class HttpAssetFetcher implements AssetFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpAssetFetcher.class);
    private static final int BUFFER_SIZE = 8192;
    private static final String PARTIAL_SUFFIX = ".part";
    private static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.114 Safari/537.36";
    private static final String ACCEPT = "image/avif,image/webp,image/apng,image/svg+xml,image/*,*/*;q=0.8";

    private final RestTemplate restTemplate;
    private final BackoffPolicy backoffPolicy;
    private final boolean allowLocalFiles;

    private record TransferResult(long bytesWritten, long declaredLength, String sha256) {}

    @Autowired
    public HttpAssetFetcher(
            @Qualifier("assetRestTemplate") RestTemplate restTemplate,
            @Value("${draft.assets.fetch.max-attempts:3}") int maxAttempts,
            @Value("${draft.assets.fetch.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${draft.assets.fetch.max-backoff-ms:8000}") long maxBackoffMs,
            @Value("${draft.assets.allow-local-files:false}") boolean allowLocalFiles
    ) {
        this.restTemplate = restTemplate;
        this.backoffPolicy = new BackoffPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
        this.allowLocalFiles = allowLocalFiles;
    }

    @Override
    public void fetch(AssetTask task, DraftWorkspace workspace) {
        String draftId = workspace.getDraftId();
        String locator = task.getLocator();
        Path target = workspace.resolveTarget(task);
        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);

        Exception lastFailure = null;
        int attempts = 0;
        while (backoffPolicy.hasAttemptsLeft(attempts)) {
            if (attempts > 0) {
                task.incrementRetryCount();
                log.info("[Fetch][draft:{}] Retrying {} (attempt {}/{})", draftId, locator, attempts + 1, backoffPolicy.getMaxAttempts());
                try {
                    backoffPolicy.sleepBeforeRetry(attempts);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw cancelled(task, partial, draftId, e);
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(task, partial, draftId, null);
            }
            attempts++;
            task.setStatus(AssetTask.Status.DOWNLOADING);
            long start = System.nanoTime();

            try {
                Files.createDirectories(target.getParent());
                TransferResult result = transfer(task, partial);
                verify(task, result);
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
                task.setBytesWritten(result.bytesWritten());
                task.setStatus(AssetTask.Status.VERIFIED);
                log.info("[Fetch][draft:{}] Fetched {} ({} bytes) into {} in {} ms", draftId, locator,
                        result.bytesWritten(), task.getTargetSubpath(), (System.nanoTime() - start) / 1_000_000);
                return;

            } catch (LifecycleCancelledException e) {
                deletePartial(partial, draftId);
                task.setStatus(AssetTask.Status.FAILED);
                throw e;

            } catch (IOException | RestClientException e) {
                // 4xx and 5xx statuses are both retried until the attempt budget runs out
                deletePartial(partial, draftId);
                if (Thread.currentThread().isInterrupted()) {
                    throw cancelled(task, partial, draftId, e);
                }
                lastFailure = e;
                log.warn("[Fetch][draft:{}] Attempt {}/{} for {} failed: {}", draftId, attempts, backoffPolicy.getMaxAttempts(), locator, e.getMessage());

            } catch (IllegalArgumentException e) {
                // malformed locator, retrying cannot help
                deletePartial(partial, draftId);
                lastFailure = e;
                break;
            }
        }

        task.setStatus(AssetTask.Status.FAILED);
        log.error("[Fetch][draft:{}] Giving up on {} after {} attempt(s)", draftId, locator, attempts);
        throw new AssetFetchException(locator,
                "Failed to fetch asset " + locator + " after " + attempts + " attempt(s)", lastFailure);
    }

    private TransferResult transfer(AssetTask task, Path partial) throws IOException {
        Path localSource = resolveLocalSource(task.getLocator());
        boolean digest = task.getExpectedSha256() != null;
        if (localSource != null) {
            try (InputStream in = Files.newInputStream(localSource)) {
                return copyToPartial(in, partial, Files.size(localSource), digest);
            }
        }

        URI uri = URI.create(task.getLocator());
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Unsupported asset locator: " + task.getLocator());
        }

        return restTemplate.execute(uri, HttpMethod.GET,
                request -> {
                    request.getHeaders().set(HttpHeaders.USER_AGENT, USER_AGENT);
                    request.getHeaders().set(HttpHeaders.ACCEPT, ACCEPT);
                    request.getHeaders().set(HttpHeaders.ACCEPT_LANGUAGE, "zh-CN,zh;q=0.9,en;q=0.8");
                },
                response -> {
                    try (InputStream body = response.getBody()) {
                        return copyToPartial(body, partial, response.getHeaders().getContentLength(), digest);
                    }
                });
    }

    private TransferResult copyToPartial(InputStream in, Path partial, long declaredLength, boolean digest) throws IOException {
        MessageDigest messageDigest = digest ? sha256() : null;
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(partial,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new LifecycleCancelledException("Download interrupted after " + total + " bytes: " + partial.getFileName());
                }
                out.write(buffer, 0, read);
                if (messageDigest != null) {
                    messageDigest.update(buffer, 0, read);
                }
                total += read;
            }
        }
        String sha = messageDigest == null ? null : HexFormat.of().formatHex(messageDigest.digest());
        return new TransferResult(total, declaredLength, sha);
    }

    private void verify(AssetTask task, TransferResult result) throws AssetIntegrityException {
        if (result.declaredLength() >= 0 && result.declaredLength() != result.bytesWritten()) {
            throw new AssetIntegrityException("Length mismatch for " + task.getLocator() + ": declared "
                    + result.declaredLength() + " bytes, received " + result.bytesWritten());
        }
        if (task.getExpectedSha256() != null && !task.getExpectedSha256().equalsIgnoreCase(result.sha256())) {
            throw new AssetIntegrityException("Checksum mismatch for " + task.getLocator() + ": expected "
                    + task.getExpectedSha256() + ", got " + result.sha256());
        }
    }

    private Path resolveLocalSource(String locator) {
        if (!allowLocalFiles) {
            return null;
        }
        try {
            if (locator.startsWith("file:")) {
                return Paths.get(URI.create(locator));
            }
            if (!locator.contains("://")) {
                Path path = Paths.get(locator);
                return Files.isRegularFile(path) ? path : null;
            }
        } catch (InvalidPathException e) {
            return null;
        }
        return null;
    }

    private LifecycleCancelledException cancelled(AssetTask task, Path partial, String draftId, Exception cause) {
        deletePartial(partial, draftId);
        task.setStatus(AssetTask.Status.FAILED);
        log.info("[Fetch][draft:{}] Fetch of {} cancelled", draftId, task.getLocator());
        return new LifecycleCancelledException("Fetch of " + task.getLocator() + " was cancelled.", cause);
    }

    private void deletePartial(Path partial, String draftId) {
        try {
            if (Files.deleteIfExists(partial)) {
                log.debug("[Fetch][draft:{}] Removed partial file {}", draftId, partial);
            }
        } catch (IOException e) {
            log.error("[Fetch][draft:{}] Failed to remove partial file {}", draftId, partial, e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
