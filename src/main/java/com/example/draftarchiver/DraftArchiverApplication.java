package com.example.draftarchiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DraftArchiverApplication {
    private static final Logger logger = LoggerFactory.getLogger(
            DraftArchiverApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DraftArchiverApplication.class, args);
        logger.info("Application started");
    }
}
