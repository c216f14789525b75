package com.showbooking.booking.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.showbooking.common.dto.BookingDto;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaEventMessagingServiceTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private KafkaEventMessagingService messagingService;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @BeforeEach
    void setUp() {
        messagingService = new KafkaEventMessagingService(kafkaTemplate, objectMapper);
        ReflectionTestUtils.setField(messagingService, "seatHoldCreatedTopic", "seat-hold-created");
        ReflectionTestUtils.setField(messagingService, "seatHoldConfirmedTopic", "seat-hold-confirmed");
        ReflectionTestUtils.setField(messagingService, "seatHoldCancelledTopic", "seat-hold-cancelled");
        ReflectionTestUtils.setField(messagingService, "seatHoldExpiredTopic", "seat-hold-expired");
    }

    // ─── Helper methods ──────────────────────────────────────────────────

    private BookingDto sampleHold(String status) {
        return BookingDto.builder()
            .holdToken("HOLD_ABC")
            .showId(1L)
            .seatLabel("A7")
            .customerName("Ada")
            .status(status)
            .holdExpiresAt(LocalDateTime.of(2030, 1, 1, 10, 0, 20))
            .build();
    }

    private CompletableFuture<SendResult<String, String>> successFuture() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("test-topic", 0), 0L, 0, 0L, 0, 0);
        ProducerRecord<String, String> producerRecord = new ProducerRecord<>("topic", "key", "value");
        return CompletableFuture.completedFuture(new SendResult<>(producerRecord, metadata));
    }

    private CompletableFuture<SendResult<String, String>> failureFuture() {
        CompletableFuture<SendResult<String, String>> future = new CompletableFuture<>();
        future.completeExceptionally(new RuntimeException("Kafka send failed"));
        return future;
    }

    // ─── publishing ──────────────────────────────────────────────────────

    @Test
    void publishSeatHoldCreated_SendsJsonKeyedByToken() throws Exception {
        when(kafkaTemplate.send(eq("seat-hold-created"), eq("HOLD_ABC"), anyString())).thenReturn(successFuture());

        messagingService.publishSeatHoldCreated(sampleHold("HELD"));

        ArgumentCaptor<String> jsonCaptor = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("seat-hold-created"), eq("HOLD_ABC"), jsonCaptor.capture());

        JsonNode event = objectMapper.readTree(jsonCaptor.getValue());
        assertEquals("SEAT_HOLD_CREATED", event.get("eventType").asText());
        assertEquals("A7", event.get("seatLabel").asText());
        assertEquals(1L, event.get("showId").asLong());
        assertEquals("HELD", event.get("status").asText());
        assertEquals("booking-service", event.get("source").asText());
    }

    @Test
    void publishSeatHoldConfirmed_UsesConfirmedTopic() {
        when(kafkaTemplate.send(eq("seat-hold-confirmed"), eq("HOLD_ABC"), contains("SEAT_HOLD_CONFIRMED")))
            .thenReturn(successFuture());

        messagingService.publishSeatHoldConfirmed(sampleHold("CONFIRMED"));

        verify(kafkaTemplate).send(eq("seat-hold-confirmed"), eq("HOLD_ABC"), anyString());
    }

    @Test
    void publishSeatHoldCancelled_UsesCancelledTopic() {
        when(kafkaTemplate.send(eq("seat-hold-cancelled"), eq("HOLD_ABC"), contains("SEAT_HOLD_CANCELLED")))
            .thenReturn(successFuture());

        messagingService.publishSeatHoldCancelled(sampleHold("CANCELLED"));

        verify(kafkaTemplate).send(eq("seat-hold-cancelled"), eq("HOLD_ABC"), anyString());
    }

    @Test
    void publishSeatHoldExpired_UsesExpiredTopic() {
        when(kafkaTemplate.send(eq("seat-hold-expired"), eq("HOLD_ABC"), contains("SEAT_HOLD_EXPIRED")))
            .thenReturn(successFuture());

        messagingService.publishSeatHoldExpired(sampleHold("CANCELLED"));

        verify(kafkaTemplate).send(eq("seat-hold-expired"), eq("HOLD_ABC"), anyString());
    }

    @Test
    void publish_SendFailure_IsSwallowed() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(failureFuture());

        assertDoesNotThrow(() -> messagingService.publishSeatHoldCreated(sampleHold("HELD")));
    }

    @Test
    void publish_TemplateThrows_IsSwallowed() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenThrow(new RuntimeException("broker gone"));

        assertDoesNotThrow(() -> messagingService.publishSeatHoldCancelled(sampleHold("CANCELLED")));
    }
}
