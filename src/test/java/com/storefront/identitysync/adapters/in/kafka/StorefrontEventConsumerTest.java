package com.storefront.identitysync.adapters.in.kafka;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.application.port.in.IngestEventUseCase;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class StorefrontEventConsumerTest {

    private static final String TOPIC = "storefront-events";
    private static final String VALID = "{\"workspace_id\":\"ws_1\",\"event_name\":\"Product Viewed\","
            + "\"anonymous_id\":\"anon_1\",\"properties\":{\"product_id\":\"p1\"}}";

    @Mock
    private IngestEventUseCase ingestEventUseCase;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private Acknowledgment ack;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StorefrontEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new StorefrontEventConsumer(ingestEventUseCase, kafkaTemplate, objectMapper,
                new SimpleMeterRegistry(), new IdentitySyncProperties());
    }

    @Test
    void testConsume_ValidEventIsIngestedAndAcked() {
        // Given
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenReturn(new IngestResult("evt_1", "uid_1", true, false, false, 0, 0, List.of()));

        // When
        consumer.consume(record(VALID), ack);

        // Then
        ArgumentCaptor<IngestCommand> captor = ArgumentCaptor.forClass(IngestCommand.class);
        verify(ingestEventUseCase).ingest(captor.capture());
        assertEquals("ws_1", captor.getValue().workspaceId());
        assertEquals("kafka", captor.getValue().source());
        assertEquals("track", captor.getValue().eventType());
        verify(ack).acknowledge();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void testConsume_ParseErrorGoesToDlq() throws Exception {
        // When
        consumer.consume(record("{not json"), ack);

        // Then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("storefront-events-dlq"), eq("anon_1"), payload.capture());
        StorefrontEventConsumer.DlqMessage message = objectMapper.readValue(payload.getValue(),
                StorefrontEventConsumer.DlqMessage.class);
        assertEquals("PARSE_ERROR", message.errorType());
        assertEquals(TOPIC, message.originalTopic());
        assertEquals(7L, message.originalOffset());
        verify(ack).acknowledge();
        verifyNoInteractions(ingestEventUseCase);
    }

    @Test
    void testConsume_MissingWorkspaceIsBusinessError() {
        // When
        consumer.consume(record("{\"event_name\":\"Product Viewed\",\"anonymous_id\":\"anon_1\"}"), ack);

        // Then
        verify(kafkaTemplate).send(eq("storefront-events-dlq"), eq("anon_1"), contains("BUSINESS_ERROR"));
        verify(ack).acknowledge();
    }

    @Test
    void testConsume_TransientFailureIsRedelivered() {
        // Given
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenThrow(new DataAccessResourceFailureException("database unavailable"));

        // When / Then
        assertThrows(RuntimeException.class, () -> consumer.consume(record(VALID), ack));
        verify(ack, never()).acknowledge();
        verifyNoInteractions(kafkaTemplate);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>(TOPIC, 0, 7L, "anon_1", value);
    }
}
