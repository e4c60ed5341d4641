package com.storefront.identitysync.adapters.in.kafka;

import java.time.Instant;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.adapters.in.rest.TrackRequest;
import com.storefront.identitysync.application.port.in.IngestEventUseCase;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Kafka inbound adapter: storefront events from the {@code storefront-events}
 * topic, same body as server-track plus {@code workspace_id}.
 * <p>
 * Error handling:
 * <ol>
 * <li><b>Parse error:</b> DLQ + skip</li>
 * <li><b>Validation error:</b> DLQ + skip</li>
 * <li><b>Transient error:</b> throw, Kafka redelivers</li>
 * <li><b>Unknown error:</b> DLQ + skip</li>
 * </ol>
 * Redelivery is safe: the dedupe key turns a replayed event into a duplicate.
 * </p>
 */
@Component
public class StorefrontEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(StorefrontEventConsumer.class);
    private static final String KAFKA_SOURCE = "kafka";

    private final IngestEventUseCase ingestEventUseCase;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String dlqTopic;

    public StorefrontEventConsumer(IngestEventUseCase ingestEventUseCase,
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            IdentitySyncProperties properties) {
        this.ingestEventUseCase = ingestEventUseCase;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.dlqTopic = properties.getKafka().getTopics().getDlq();
    }

    @KafkaListener(topics = "${identity-sync.kafka.topics.storefront-events:storefront-events}", groupId = "identity-sync", containerFactory = "kafkaListenerContainerFactory")
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String key = record.key();
        try {
            MDC.put("kafkaTopic", record.topic());
            MDC.put("kafkaPartition", String.valueOf(record.partition()));
            MDC.put("kafkaOffset", String.valueOf(record.offset()));

            TrackRequest request = objectMapper.readValue(record.value(), TrackRequest.class);
            if (request.getWorkspaceId() == null || request.getWorkspaceId().isBlank()) {
                throw new IllegalArgumentException("workspace_id is required");
            }
            MDC.put("workspaceId", request.getWorkspaceId());

            IngestResult result = ingestEventUseCase.ingest(request.toCommand(request.getWorkspaceId(), KAFKA_SOURCE));
            countIngest(result.duplicate() ? "duplicate" : "accepted");

            ack.acknowledge();
            log.info("action=event_consumed eventId={} unifiedUserId={} duplicate={}",
                    result.eventId(), result.unifiedUserId(), result.duplicate());

        } catch (JsonProcessingException e) {
            log.error("action=parse_error key={} error={}", key, e.getMessage());
            countIngest("rejected");
            sendToDlq(record, "PARSE_ERROR", e);
            ack.acknowledge();

        } catch (IllegalStateException | IllegalArgumentException e) {
            // validation and payload limits
            log.error("action=business_error key={} error={}", key, e.getMessage());
            countIngest("rejected");
            sendToDlq(record, "BUSINESS_ERROR", e);
            ack.acknowledge();

        } catch (DataAccessException e) {
            // includes RedisConnectionFailureException
            log.error("action=transient_error key={} error={}", key, e.getMessage());
            throw new RuntimeException("Transient infrastructure error", e);

        } catch (Exception e) {
            log.error("action=unknown_error key={} error={}", key, e.getMessage(), e);
            countIngest("rejected");
            sendToDlq(record, "UNKNOWN_ERROR", e);
            ack.acknowledge();

        } finally {
            MDC.clear();
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    private void sendToDlq(ConsumerRecord<String, String> record, String errorType, Exception error) {
        try {
            DlqMessage dlqMessage = new DlqMessage(
                    record.topic(),
                    record.partition(),
                    record.offset(),
                    record.key(),
                    record.value(),
                    errorType,
                    error.getMessage(),
                    Instant.now().toString());

            kafkaTemplate.send(dlqTopic, record.key(), objectMapper.writeValueAsString(dlqMessage));
            log.warn("action=sent_to_dlq errorType={} key={} originalTopic={}",
                    errorType, record.key(), record.topic());
        } catch (Exception dlqError) {
            log.error("action=dlq_send_failed key={} error={}", record.key(), dlqError.getMessage());
        }
    }

    private void countIngest(String status) {
        meterRegistry.counter("identity_sync.ingest.outcome", "status", status, "channel", KAFKA_SOURCE).increment();
    }

    /**
     * DLQ envelope with error context.
     */
    public record DlqMessage(
            String originalTopic,
            int originalPartition,
            long originalOffset,
            String originalKey,
            String originalValue,
            String errorType,
            String errorMessage,
            String timestamp) {
    }
}
