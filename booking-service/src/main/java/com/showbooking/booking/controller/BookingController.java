package com.showbooking.booking.controller;

import com.showbooking.booking.service.HoldNotFoundException;
import com.showbooking.booking.service.ReservationStore;
import com.showbooking.common.dto.BookingDto;
import com.showbooking.common.dto.SeatHoldRequest;
import com.showbooking.common.dto.SeatHoldResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Booking Controller", description = "Seat hold, confirmation and release")
public class BookingController {

    private final ReservationStore reservationStore;

    @PostMapping("/hold")
    @Operation(
        summary = "Hold a seat",
        description = "Hold one AVAILABLE seat for booking.hold.duration.seconds. " +
                     "Of several concurrent requests for the same seat exactly one succeeds."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Seat held"),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "Show or seat not found"),
        @ApiResponse(responseCode = "409", description = "Seat is already held or booked"),
        @ApiResponse(responseCode = "503", description = "Storage unavailable, retry")
    })
    public ResponseEntity<SeatHoldResponse> holdSeat(@Valid @RequestBody SeatHoldRequest request) {

        log.info("Seat hold request: show={} seat={} by={}",
                request.getShowId(), request.getSeatLabel(), request.getCustomerName());

        SeatHoldResponse response = reservationStore.tryHold(
            request.getShowId(), request.getSeatLabel(), request.getCustomerName());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{holdToken}/confirm")
    @Operation(
        summary = "Confirm a held seat",
        description = "Book the held seat. Rejected once the hold deadline has passed, " +
                     "even if the seat has not been reclaimed yet."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Booking confirmed"),
        @ApiResponse(responseCode = "404", description = "Hold not found or no longer active"),
        @ApiResponse(responseCode = "410", description = "Hold expired"),
        @ApiResponse(responseCode = "503", description = "Storage unavailable, retry")
    })
    public ResponseEntity<BookingDto> confirmBooking(
            @Parameter(description = "Hold token from seat hold response") @PathVariable String holdToken) {

        log.info("Booking confirmation request for hold: {}", holdToken);

        return ResponseEntity.ok(reservationStore.confirm(holdToken));
    }

    @DeleteMapping("/hold/{holdToken}")
    @Operation(
        summary = "Release a seat hold",
        description = "Give the held seat back before its deadline."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Seat hold released"),
        @ApiResponse(responseCode = "404", description = "Hold not found or already ended"),
        @ApiResponse(responseCode = "503", description = "Storage unavailable, retry")
    })
    public ResponseEntity<Void> releaseSeatHold(
            @Parameter(description = "Hold token to release") @PathVariable String holdToken) {

        log.info("Seat hold release request for hold: {}", holdToken);

        reservationStore.release(holdToken);

        return ResponseEntity.noContent().build();
    }

    @GetMapping("/hold/{holdToken}")
    @Operation(
        summary = "Get seat hold details",
        description = "Current status of a booking transaction; used to resume a hold after reconnecting."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Hold found"),
        @ApiResponse(responseCode = "404", description = "Hold not found")
    })
    public ResponseEntity<BookingDto> getSeatHold(
            @Parameter(description = "Hold token to lookup") @PathVariable String holdToken) {

        log.debug("Seat hold lookup request for: {}", holdToken);

        return reservationStore.getHold(holdToken)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new HoldNotFoundException(holdToken));
    }

    @GetMapping("/health")
    @Operation(
        summary = "Health check endpoint",
        description = "Simple health check for load balancer and monitoring."
    )
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Booking Service is healthy");
    }
}
