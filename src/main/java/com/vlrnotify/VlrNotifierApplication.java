package com.vlrnotify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the vlr.gg match notifier.
 *
 * The Mongo client is created by {@link com.vlrnotify.infrastructure.config.MongoConfig} only when the
 * Mongo store is selected.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@ConfigurationPropertiesScan
@EnableScheduling
public class VlrNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(VlrNotifierApplication.class, args);
    }
}
