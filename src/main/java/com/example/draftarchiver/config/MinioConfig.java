package com.example.draftarchiver.config;

import io.minio.MinioClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MinioConfig {

    private static final Logger log = LoggerFactory.getLogger(MinioConfig.class);

    @Value("${storage.minio.endpoint}")
    private String endpoint;

    @Value("${storage.minio.access-key}")
    private String accessKey;

    @Value("${storage.minio.secret-key}")
    private String secretKey;

    @Value("${storage.minio.region:}")
    private String region;

    @Bean
    public MinioClient minioClient() {
        if (endpoint == null || endpoint.isBlank()) {
            log.error("storage.minio.endpoint is not configured. Object storage client cannot be initialized.");
            throw new IllegalStateException("storage.minio.endpoint is required but not configured.");
        }
        log.info("Creating MinioClient bean for endpoint: {}", endpoint);
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey);
        if (region != null && !region.isBlank()) {
            builder.region(region);
        }
        return builder.build();
    }
}
