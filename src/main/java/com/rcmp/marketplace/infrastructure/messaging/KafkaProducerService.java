package com.rcmp.marketplace.infrastructure.messaging;

import com.rcmp.marketplace.infrastructure.messaging.events.ListingSoldEvent;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for marketplace domain events.
 *
 * Key: listing ID, so every event about one listing lands on the same partition.
 * Publishing is fire-and-forget: the sale is already committed when this runs,
 * and a broker outage must not turn an acknowledged webhook into a retry loop.
 *
 * @author Marketplace Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MarketplaceMetricsService metricsService;
    private final String listingSoldTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            MarketplaceMetricsService metricsService,
            @Value("${marketplace.kafka.topics.listing-sold:marketplace-listing-sold}") String listingSoldTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.listingSoldTopic = listingSoldTopic;
    }

    /**
     * Publish listing sold event.
     * Never throws: failures are logged and counted.
     *
     * @param event Listing sold event
     */
    public void publishListingSold(ListingSoldEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    listingSoldTopic,
                    event.getListingId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published listing sold event for listing {}, partition: {}",
                            event.getListingId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish listing sold event for listing {}",
                            event.getListingId(), ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "publishListingSold");
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing listing sold event for listing {}", event.getListingId(), e);
            metricsService.recordError("SERIALIZATION_ERROR", "publishListingSold");
        } catch (KafkaException | org.springframework.kafka.KafkaException e) {
            // Metadata or buffer timeout raised by send() itself
            logger.error("Kafka rejected listing sold event for listing {}", event.getListingId(), e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "publishListingSold");
        }
    }
}
