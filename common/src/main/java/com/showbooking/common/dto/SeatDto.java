package com.showbooking.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    private Long showId;

    private String label;

    private String rowLetter;

    private Integer seatNumber;

    private String status; // AVAILABLE, HELD, BOOKED

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime holdExpiresAt;

    private String bookedByName;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime bookedAt;

    // Helper methods
    public boolean isAvailable() {
        return "AVAILABLE".equals(status);
    }

    public boolean isHeld() {
        return "HELD".equals(status);
    }

    public boolean isBooked() {
        return "BOOKED".equals(status);
    }
}
