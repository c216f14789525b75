package com.showbooking.booking.service;

public class SeatNotFoundException extends BookingException {

    public SeatNotFoundException(Long showId, String seatLabel) {
        super(RejectionReason.SEAT_NOT_FOUND, "Seat " + seatLabel + " not found in show " + showId);
    }
}
