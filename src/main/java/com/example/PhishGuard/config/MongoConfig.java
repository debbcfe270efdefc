package com.example.PhishGuard.config;

import com.mongodb.WriteConcern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Connection pool and durability settings for the prediction store.
 * The URI and database name come from {@code MONGODB_URI} / {@code MONGODB_DB_NAME}
 * through application.properties; these settings are applied on top of the URI.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer predictionStoreSettings(
            @Value("${MONGODB_MIN_POOL_SIZE:10}") int minPoolSize,
            @Value("${MONGODB_MAX_POOL_SIZE:50}") int maxPoolSize,
            @Value("${MONGODB_POOL_WAIT_MS:5000}") long poolWaitMs) {
        return builder -> builder
                .applyToConnectionPoolSettings(pool -> pool
                        .minSize(minPoolSize)
                        .maxSize(maxPoolSize)
                        .maxWaitTime(poolWaitMs, TimeUnit.MILLISECONDS)
                        .maxConnectionIdleTime(45, TimeUnit.SECONDS))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(5, TimeUnit.SECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(10, TimeUnit.SECONDS)
                        .readTimeout(45, TimeUnit.SECONDS))
                .retryWrites(true)
                .writeConcern(WriteConcern.MAJORITY);
    }
}
