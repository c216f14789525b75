package com.showbooking.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Client view of a booking transaction. Seat label, token and hold expiry are
 * enough for a client to resume or release a hold after reconnecting.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingDto {

    private String holdToken;

    private Long showId;

    private String seatLabel;

    private String customerName;

    private String status; // HELD, CONFIRMED, CANCELLED

    private String cancellationReason; // RELEASED, EXPIRED

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime holdExpiresAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime confirmedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime cancelledAt;

    // Helper methods
    public boolean isHeld() {
        return "HELD".equals(status);
    }

    public boolean isConfirmed() {
        return "CONFIRMED".equals(status);
    }

    public boolean isCancelled() {
        return "CANCELLED".equals(status);
    }
}
