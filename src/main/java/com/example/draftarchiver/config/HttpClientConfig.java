package com.example.draftarchiver.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Value("${draft.assets.fetch.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${draft.assets.fetch.read-timeout-ms:180000}")
    private int readTimeoutMs;

    @Bean(name = "assetRestTemplate")
    public RestTemplate assetRestTemplate(RestTemplateBuilder builder) {
        log.info("Creating asset RestTemplate - connect timeout: {} ms, read timeout: {} ms", connectTimeoutMs, readTimeoutMs);
        return builder
                .requestFactory(() -> {
                    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
                    factory.setConnectTimeout(connectTimeoutMs);
                    factory.setReadTimeout(readTimeoutMs);
                    return factory;
                })
                .build();
    }
}
