package com.showbooking.booking.controller;

import com.showbooking.booking.service.ReservationStore;
import com.showbooking.booking.service.ShowService;
import com.showbooking.common.dto.CreateShowRequest;
import com.showbooking.common.dto.SeatDto;
import com.showbooking.common.dto.ShowDto;
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

import java.util.List;

@RestController
@RequestMapping("/api/shows")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Show Controller", description = "Show provisioning and seat maps")
public class ShowController {

    private final ShowService showService;
    private final ReservationStore reservationStore;

    @PostMapping
    @Operation(
        summary = "Create a show",
        description = "Provision a show with its seats, all AVAILABLE. Without a body the show " +
                     "gets booking.show.default-seat-count seats in row A."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Show created"),
        @ApiResponse(responseCode = "400", description = "Invalid seat count")
    })
    public ResponseEntity<ShowDto> createShow(@Valid @RequestBody(required = false) CreateShowRequest request) {
        CreateShowRequest body = request != null ? request : new CreateShowRequest();

        log.info("Create show request: name={} seats={} perRow={}",
                body.getName(), body.getSeatCount(), body.getSeatsPerRow());

        ShowDto show = showService.createShow(body.getName(), body.getSeatCount(), body.getSeatsPerRow());
        return ResponseEntity.status(HttpStatus.CREATED).body(show);
    }

    @GetMapping
    @Operation(summary = "List shows", description = "Newest first, with the number of AVAILABLE seats.")
    public ResponseEntity<List<ShowDto>> listShows() {
        return ResponseEntity.ok(showService.listShows());
    }

    @GetMapping("/{showId}/seats")
    @Operation(
        summary = "List seats of a show",
        description = "Seat map in natural label order (A2 before A10)."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Seats listed"),
        @ApiResponse(responseCode = "404", description = "Show not found")
    })
    public ResponseEntity<List<SeatDto>> listSeats(
            @Parameter(description = "Show ID") @PathVariable Long showId) {

        log.debug("Seat map request for show: {}", showId);

        return ResponseEntity.ok(reservationStore.listSeats(showId));
    }
}
