package com.showbooking.booking.controller;

import com.showbooking.booking.exception.GlobalExceptionHandler;
import com.showbooking.booking.service.HoldExpiredException;
import com.showbooking.booking.service.HoldNotFoundException;
import com.showbooking.booking.service.ReservationStore;
import com.showbooking.booking.service.SeatUnavailableException;
import com.showbooking.booking.service.ShowService;
import com.showbooking.common.dto.SeatHoldResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP status and error body mapping of the booking endpoints.
 */
@ExtendWith(MockitoExtension.class)
class BookingApiMockMvcTest {

    @Mock
    private ReservationStore reservationStore;

    @Mock
    private ShowService showService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new BookingController(reservationStore), new ShowController(showService, reservationStore))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void hold_Created() throws Exception {
        when(reservationStore.tryHold(1L, "A1", "Ada")).thenReturn(SeatHoldResponse.builder()
            .holdToken("HOLD_1").showId(1L).seatLabel("A1").customerName("Ada")
            .expiresAt(LocalDateTime.of(2030, 1, 1, 10, 0, 20)).timeRemainingSeconds(20).status("HELD").build());

        mockMvc.perform(post("/api/bookings/hold")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"showId\":1,\"seatLabel\":\"A1\",\"customerName\":\"Ada\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.holdToken").value("HOLD_1"))
            .andExpect(jsonPath("$.expiresAt").value("2030-01-01T10:00:20"));
    }

    @Test
    void hold_SeatTaken_Conflict() throws Exception {
        when(reservationStore.tryHold(1L, "A1", "Bob")).thenThrow(new SeatUnavailableException(1L, "A1"));

        mockMvc.perform(post("/api/bookings/hold")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"showId\":1,\"seatLabel\":\"A1\",\"customerName\":\"Bob\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.reason").value("SEAT_UNAVAILABLE"))
            .andExpect(jsonPath("$.retryable").value(false))
            .andExpect(jsonPath("$.path").value("/api/bookings/hold"));
    }

    @Test
    void hold_MissingName_BadRequest() throws Exception {
        mockMvc.perform(post("/api/bookings/hold")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"showId\":1,\"seatLabel\":\"A1\",\"customerName\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.validationErrors.customerName").exists());

        verifyNoInteractions(reservationStore);
    }

    @Test
    void confirm_Expired_Gone() throws Exception {
        when(reservationStore.confirm("HOLD_1"))
            .thenThrow(new HoldExpiredException("HOLD_1", LocalDateTime.of(2030, 1, 1, 10, 0, 20)));

        mockMvc.perform(post("/api/bookings/HOLD_1/confirm"))
            .andExpect(status().isGone())
            .andExpect(jsonPath("$.reason").value("HOLD_EXPIRED"));
    }

    @Test
    void release_Twice_SecondIsNotFound() throws Exception {
        doNothing().doThrow(new HoldNotFoundException("HOLD_1")).when(reservationStore).release("HOLD_1");

        mockMvc.perform(delete("/api/bookings/hold/HOLD_1"))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/bookings/hold/HOLD_1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.reason").value("HOLD_NOT_FOUND"));
    }

    @Test
    void storageFailure_ServiceUnavailableAndRetryable() throws Exception {
        when(reservationStore.confirm("HOLD_1")).thenThrow(new DataAccessResourceFailureException("db down"));

        mockMvc.perform(post("/api/bookings/HOLD_1/confirm"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void createShow_AboveCap_BadRequest() throws Exception {
        when(showService.createShow(null, 1000, null))
            .thenThrow(new IllegalArgumentException("Seat count must be between 1 and 500: 1000"));

        mockMvc.perform(post("/api/shows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seatCount\":1000}"))
            .andExpect(status().isBadRequest());
    }
}
