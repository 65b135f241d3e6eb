package com.rcmp.marketplace.infrastructure.messaging;

import com.rcmp.marketplace.exception.NotificationDeliveryException;
import com.rcmp.marketplace.infrastructure.messaging.events.PasswordResetLinkMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes reset links to the mail relay topic and waits for the broker ack,
 * so the caller learns about a failed hand-off instead of reporting success.
 *
 * @author Marketplace Team
 */
@Component
public class KafkaResetLinkSender implements ResetLinkSender {

    private static final Logger logger = LoggerFactory.getLogger(KafkaResetLinkSender.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaResetLinkSender(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${marketplace.kafka.topics.password-reset-links:marketplace-password-reset-links}") String topic,
            @Value("${marketplace.kafka.send-timeout:PT10S}") Duration sendTimeout
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void send(PasswordResetLinkMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("Could not serialize reset link message", e);
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, message.getUsername(), payload)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("Queued password reset link for user {}, partition: {}",
                    message.getUsername(), result.getRecordMetadata().partition());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Interrupted while queueing reset link", e);
        } catch (ExecutionException | TimeoutException
                 | KafkaException | org.springframework.kafka.KafkaException e) {
            logger.error("Failed to queue password reset link for user {}", message.getUsername(), e);
            throw new NotificationDeliveryException("Reset link could not be delivered", e);
        }
    }
}
