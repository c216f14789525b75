package com.showbooking.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatHoldRequest {

    @NotNull(message = "Show ID is required")
    private Long showId;

    @NotBlank(message = "Seat label is required")
    @Pattern(regexp = "^[A-Za-z]+[1-9][0-9]*$", message = "Seat label must look like A1")
    private String seatLabel;

    @NotBlank(message = "Customer name is required")
    @Size(max = 100, message = "Customer name must not exceed 100 characters")
    private String customerName;
}
