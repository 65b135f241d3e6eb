package com.rcmp.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the RCMP123 marketplace backend.
 *
 * System Overview:
 * - Sellers list items (title, description, price, image reference)
 * - Buyers pay through a Stripe-hosted checkout session
 * - A signed Stripe webhook marks the listing sold, exactly once
 * - Optional Connect fee split: platform fee kept, remainder routed to the seller
 * - Password recovery with short-lived signed reset tokens
 * - Sliding-window rate limiting on login and credential-reset endpoints
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: checkout orchestration, webhook fulfillment, account recovery
 * - Data Access Layer: JPA repositories, conditional UPDATE for the sale transition
 * - Infrastructure Layer: Stripe client, token signing, Redis, Kafka, metrics
 *
 * @author Marketplace Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
@ConfigurationPropertiesScan
public class MarketplaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketplaceApplication.class, args);
    }
}
