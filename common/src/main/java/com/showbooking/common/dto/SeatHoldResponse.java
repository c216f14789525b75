package com.showbooking.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatHoldResponse {

    private String holdToken;
    private Long showId;
    private String seatLabel;
    private String customerName;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime expiresAt;

    private long timeRemainingSeconds;
    private String status;

    // Instructions for the user
    private String message;
}
