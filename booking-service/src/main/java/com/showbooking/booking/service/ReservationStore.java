package com.showbooking.booking.service;

import com.showbooking.common.dto.BookingDto;
import com.showbooking.common.dto.SeatDto;
import com.showbooking.common.dto.SeatHoldResponse;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative seat state. Every mutating call is one atomic check-and-set: it either
 * applies its whole transition or rejects with a {@link BookingException} and changes
 * nothing.
 */
public interface ReservationStore {

    /**
     * Hold an AVAILABLE seat for the configured hold duration
     *
     * @param showId Show owning the seat
     * @param seatLabel Seat label such as A10
     * @param customerName Display name of the requesting party
     * @return The new hold, with its token and expiry
     * @throws SeatUnavailableException if the seat is HELD or BOOKED
     * @throws ShowNotFoundException if the show does not exist
     * @throws SeatNotFoundException if the show has no such seat
     */
    SeatHoldResponse tryHold(Long showId, String seatLabel, String customerName);

    /**
     * Turn an active hold into a booking
     *
     * @throws HoldNotFoundException if the token is unknown or no longer HELD
     * @throws HoldExpiredException if the hold deadline has passed, swept or not
     */
    BookingDto confirm(String holdToken);

    /**
     * Give a held seat back before its deadline
     *
     * @throws HoldNotFoundException if the token is unknown or no longer HELD
     */
    void release(String holdToken);

    /**
     * Snapshot of a show's seats in natural label order
     *
     * @throws ShowNotFoundException if the show does not exist
     */
    List<SeatDto> listSeats(Long showId);

    /**
     * Current state of a booking transaction, whatever its status
     */
    Optional<BookingDto> getHold(String holdToken);
}
