package com.agrivision.ingestion.config;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Pings MongoDB while the application context starts. The reactive driver connects lazily, so
 * without this check the service would bind its port and accept readings it cannot store.
 * <p>
 * The web server only starts listening after all singletons are initialized; a failed ping
 * aborts startup and the process exits with a non-zero status.
 */
@Component
@Slf4j
public class MongoConnectionVerifier implements InitializingBean {

    private static final Document PING = new Document("ping", 1);

    private final ReactiveMongoOperations mongoOperations;
    private final String databaseName;
    private final Duration timeout;

    public MongoConnectionVerifier(
            ReactiveMongoOperations mongoOperations,
            @Value("${spring.data.mongodb.database:AgriVision_IoT}") String databaseName,
            @Value("${agrivision.mongodb.startup-timeout:10s}") Duration timeout) {
        this.mongoOperations = mongoOperations;
        this.databaseName = databaseName;
        this.timeout = timeout;
    }

    @Override
    public void afterPropertiesSet() {
        verifyConnection();
    }

    /**
     * @throws IllegalStateException when MongoDB does not answer within the startup timeout
     */
    public void verifyConnection() {
        try {
            mongoOperations.executeCommand(PING).block(timeout);
        } catch (RuntimeException e) {
            log.error("Failed to connect to MongoDB (database={}): {}", databaseName, e.getMessage(), e);
            throw new IllegalStateException("MongoDB is not reachable, refusing to start", e);
        }
        log.info("Connected to MongoDB: {}", databaseName);
    }
}
