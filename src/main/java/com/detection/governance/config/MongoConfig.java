package com.detection.governance.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

@Configuration
@Slf4j
@ConditionalOnProperty(name = "governance.store.type", havingValue = "mongo", matchIfMissing = true)
@EnableMongoRepositories(basePackages = "com.detection.governance.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri:mongodb://localhost:27017}")
    private String uri;

    @Value("${spring.data.mongodb.database:content_governance}")
    private String database;

    @Value("${governance.mongo.pool.max-size:50}")
    private int maxPoolSize;

    @Value("${governance.mongo.pool.min-size:5}")
    private int minPoolSize;

    @Value("${governance.mongo.pool.max-idle-seconds:60}")
    private long maxIdleSeconds;

    @Value("${governance.mongo.timeout-seconds:10}")
    private int timeoutSeconds;

    @Override
    protected String getDatabaseName() {
        return database;
    }

    // Index annotations on ContentItem are applied on startup
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Override
    public MongoClient mongoClient() {
        log.info("Connecting content store to MongoDB database '{}' (pool {}-{}, timeout {}s)",
                database, minPoolSize, maxPoolSize, timeoutSeconds);
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(uri))
                .applyToConnectionPoolSettings(pool -> pool
                        .minSize(minPoolSize)
                        .maxSize(maxPoolSize)
                        .maxConnectionIdleTime(maxIdleSeconds, TimeUnit.SECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(timeoutSeconds, TimeUnit.SECONDS))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoTemplate mongoTemplate() {
        return new MongoTemplate(mongoClient(), getDatabaseName());
    }
}
