package com.fleetops.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Audit entries get their createdAt from Mongo auditing.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.fleetops.agent.audit")
public class MongoConfig {
}
