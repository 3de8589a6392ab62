package com.cred.freestyle.marketplace.infrastructure.messaging;

import com.cred.freestyle.marketplace.infrastructure.messaging.events.NotificationMessage;
import com.cred.freestyle.marketplace.infrastructure.messaging.events.PaymentEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for payment events and user notifications.
 *
 * Topic partitioning strategy:
 * - Key: user_id (all events of one user land on the same partition, in order)
 *
 * Sends are fire-and-forget: a failed publish is logged and never fails the
 * business operation that triggered it.
 *
 * @author Marketplace Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${marketplace.kafka.topics.payment-events:marketplace-payment-events}")
    private String paymentEventsTopic;

    @Value("${marketplace.kafka.topics.notifications:marketplace-notifications}")
    private String notificationsTopic;

    public KafkaProducerService(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish a payment or entitlement lifecycle event.
     *
     * @param event Payment event
     */
    public void publishPaymentEvent(PaymentEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            send(paymentEventsTopic, event.getUserId(), payload,
                    event.getEventType() + " for user " + event.getUserId());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing payment event {}", event, e);
        }
    }

    /**
     * Ask the notification dispatcher to notify a user.
     *
     * @param message Notification message
     */
    public void publishNotification(NotificationMessage message) {
        try {
            String payload = objectMapper.writeValueAsString(message);
            send(notificationsTopic, message.getUserId(), payload,
                    "notification '" + message.getTemplate() + "' for user " + message.getUserId());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing notification '{}' for user {}",
                    message.getTemplate(), message.getUserId(), e);
        }
    }

    private void send(String topic, String key, String payload, String description) {
        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} to {}, partition: {}",
                            description, topic, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} to {}", description, topic, ex);
                }
            });
        } catch (RuntimeException e) {
            logger.error("Failed to hand {} to the Kafka producer", description, e);
        }
    }
}
