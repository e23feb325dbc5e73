package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.exceptions.ObjectStorageException;
import com.example.draftarchiver.service.ObjectStorageClient;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.InsufficientDataException;
import io.minio.errors.ServerException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

@Service
public class MinioObjectStorageClient implements ObjectStorageClient {

    private static final Logger log = LoggerFactory.getLogger(MinioObjectStorageClient.class);

    private static final Set<String> PERMANENT_ERROR_CODES = Set.of(
            "AccessDenied", "InvalidAccessKeyId", "SignatureDoesNotMatch", "NoSuchBucket",
            "InvalidBucketName", "AccountProblem", "AllAccessDisabled");
    private static final Set<String> MISSING_OBJECT_CODES = Set.of("NoSuchKey", "NoSuchObject");

    private final MinioClient minioClient;
    private final String endpoint;
    private final String bucket;
    private final String publicBaseUrl;
    private final boolean createBucket;

    @Autowired
    public MinioObjectStorageClient(MinioClient minioClient,
                                    @Value("${storage.minio.endpoint}") String endpoint,
                                    @Value("${storage.minio.bucket}") String bucket,
                                    @Value("${storage.minio.public-base-url:}") String publicBaseUrl,
                                    @Value("${storage.minio.create-bucket:false}") boolean createBucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Object storage bucket cannot be blank in configuration.");
        }
        this.minioClient = minioClient;
        this.endpoint = stripTrailingSlash(endpoint);
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl == null || publicBaseUrl.isBlank() ? null : stripTrailingSlash(publicBaseUrl);
        this.createBucket = createBucket;
    }

    @PostConstruct
    private void initialize() {
        if (!createBucket) {
            return;
        }
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!found) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created object storage bucket: {}", bucket);
            } else {
                log.info("Object storage bucket already exists: {}", bucket);
            }
        } catch (Exception e) {
            // uploads will report the problem per run
            log.error("Failed to initialize object storage bucket: {}", bucket, e);
        }
    }

    @Override
    public String put(String key, InputStream content, long size, String contentType) {
        try {
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucket)
                            .object(key)
                            .stream(content, size, -1)
                            .contentType(contentType)
                            .build());
            log.debug("[Storage] Put {} ({} bytes) into bucket {}", key, size, bucket);
            return urlFor(key);
        } catch (Exception e) {
            throw translate("put", key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            return true;
        } catch (ErrorResponseException e) {
            if (MISSING_OBJECT_CODES.contains(e.errorResponse().code())) {
                return false;
            }
            throw translate("stat", key, e);
        } catch (Exception e) {
            throw translate("stat", key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            log.debug("[Storage] Removed {} from bucket {}", key, bucket);
        } catch (ErrorResponseException e) {
            if (MISSING_OBJECT_CODES.contains(e.errorResponse().code())) {
                log.debug("[Storage] {} was already absent from bucket {}", key, bucket);
                return;
            }
            throw translate("remove", key, e);
        } catch (Exception e) {
            throw translate("remove", key, e);
        }
    }

    @Override
    public String urlFor(String key) {
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + key;
        }
        return endpoint + "/" + bucket + "/" + key;
    }

    static ObjectStorageException translate(String operation, String key, Exception e) {
        boolean transientFailure = isTransient(e);
        String message = "Object storage " + operation + " failed for " + key + ": " + e.getMessage();
        return new ObjectStorageException(message, e, transientFailure);
    }

    private static boolean isTransient(Exception e) {
        if (e instanceof ErrorResponseException) {
            String code = ((ErrorResponseException) e).errorResponse().code();
            return !PERMANENT_ERROR_CODES.contains(code);
        }
        return e instanceof IOException
                || e instanceof ServerException
                || e instanceof InsufficientDataException;
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
