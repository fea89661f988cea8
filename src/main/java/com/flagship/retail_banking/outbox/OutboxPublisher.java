package com.flagship.retail_banking.outbox;

import com.flagship.retail_banking.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background publisher that drains the outbox into Kafka.
 *
 * Flow:
 * 1. Poll a batch of unpublished events still under the retry limit
 * 2. Route each event to a topic by its aggregate type
 * 3. Send it keyed by aggregate id, so events about one transfer keep their order
 * 4. Wait for the broker acknowledgement, then mark the event published
 * 5. On failure bump the retry count; at max-retries the event stays behind as a dead letter
 *
 * Delivery is at-least-once: a crash between steps 4 and 5 republishes the event.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String TRANSFER_AGGREGATE = "Transfer";
    static final String RECOVERY_AGGREGATE = "RecoveryLog";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.transfers:transfers}")
    private String transfersTopic;

    @Value("${kafka.topic.transfer-failures:transfer-failures}")
    private String transferFailuresTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(maxRetries, batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            // Block until the broker acks; only then is the event safe to mark
            SendResult<String, String> result = kafkaTemplate
                .send(topic, event.getAggregateId(), event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            // Marked after the ack, never before
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            // Restore the flag so the scheduler thread can shut down
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            // retryCount is the value read before markFailed incremented it
            if (event.getRetryCount() + 1 >= maxRetries) {
                // The poll query skips it from now on; the row is kept for manual replay
                log.warn("Event {} reached max retries ({}) and is now a dead letter. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Recovery entries feed the failures topic; everything else is a transfer event.
     */
    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case RECOVERY_AGGREGATE -> transferFailuresTopic;
            default -> transfersTopic;
        };
    }
}
