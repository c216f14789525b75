package com.showbooking.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateShowRequest {

    @Size(max = 200, message = "Name must not exceed 200 characters")
    private String name;

    // Optional: falls back to booking.show.default-seat-count
    @Positive(message = "Seat count must be positive")
    private Integer seatCount;

    // Optional: all seats in row A when absent
    @Positive(message = "Seats per row must be positive")
    private Integer seatsPerRow;
}
