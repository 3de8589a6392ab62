package com.cred.freestyle.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the classified-ads marketplace backend.
 *
 * System Overview:
 * - Premium subscriptions and ad boosts sold through a payment ledger
 * - Payment gateway callbacks settle transactions and activate the purchased entitlement
 * - Activation flips the owning user's premium flag or the boosted ad's premium tier
 * - Ad listing ranks premium ads first, then newest first
 * - Periodic sweep expires lapsed entitlements
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: ledger, activation, subscriptions, boosts, pricing plans, ad queries
 * - Data Access Layer: JPA repositories with pessimistic locking on callback and cancellation paths
 * - Infrastructure Layer: Redis cache, Kafka events and notifications, CloudWatch metrics
 *
 * @author Marketplace Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class MarketplaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketplaceApplication.class, args);
    }
}
