package com.showbooking.booking.service;

/**
 * The seat was not AVAILABLE when the hold was attempted.
 */
public class SeatUnavailableException extends BookingException {

    public SeatUnavailableException(Long showId, String seatLabel) {
        super(RejectionReason.SEAT_UNAVAILABLE,
              "Seat " + seatLabel + " of show " + showId + " is not available");
    }
}
