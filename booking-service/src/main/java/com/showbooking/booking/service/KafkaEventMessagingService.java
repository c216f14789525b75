package com.showbooking.booking.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.showbooking.common.dto.BookingDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
@Slf4j
@RequiredArgsConstructor
public class KafkaEventMessagingService implements EventMessagingService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topics.seat-hold-created:seat-hold-created}")
    private String seatHoldCreatedTopic;

    @Value("${kafka.topics.seat-hold-confirmed:seat-hold-confirmed}")
    private String seatHoldConfirmedTopic;

    @Value("${kafka.topics.seat-hold-cancelled:seat-hold-cancelled}")
    private String seatHoldCancelledTopic;

    @Value("${kafka.topics.seat-hold-expired:seat-hold-expired}")
    private String seatHoldExpiredTopic;

    @Override
    public void publishSeatHoldCreated(BookingDto hold) {
        publish(seatHoldCreatedTopic, "SEAT_HOLD_CREATED", hold);
    }

    @Override
    public void publishSeatHoldConfirmed(BookingDto booking) {
        publish(seatHoldConfirmedTopic, "SEAT_HOLD_CONFIRMED", booking);
    }

    @Override
    public void publishSeatHoldCancelled(BookingDto hold) {
        publish(seatHoldCancelledTopic, "SEAT_HOLD_CANCELLED", hold);
    }

    @Override
    public void publishSeatHoldExpired(BookingDto hold) {
        publish(seatHoldExpiredTopic, "SEAT_HOLD_EXPIRED", hold);
    }

    private void publish(String topic, String eventType, BookingDto booking) {
        String holdToken = booking.getHoldToken();

        try {
            String eventJson = objectMapper.writeValueAsString(createEvent(eventType, booking));

            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(topic, holdToken, eventJson);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish {} event: {}", eventType, holdToken, throwable);
                } else {
                    log.debug("Published {} event: {} to partition: {}",
                             eventType, holdToken, result.getRecordMetadata().partition());
                }
            });

        } catch (Exception e) {
            log.error("Error creating {} event: {}", eventType, holdToken, e);
        }
    }

    private Map<String, Object> createEvent(String eventType, BookingDto booking) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("holdToken", booking.getHoldToken());
        event.put("showId", booking.getShowId());
        event.put("seatLabel", booking.getSeatLabel());
        event.put("customerName", booking.getCustomerName());
        event.put("status", booking.getStatus());
        event.put("cancellationReason", booking.getCancellationReason());
        event.put("holdExpiresAt", booking.getHoldExpiresAt());
        event.put("confirmedAt", booking.getConfirmedAt());
        event.put("cancelledAt", booking.getCancelledAt());
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", "booking-service");
        return event;
    }
}
