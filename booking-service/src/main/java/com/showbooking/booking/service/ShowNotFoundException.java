package com.showbooking.booking.service;

public class ShowNotFoundException extends BookingException {

    public ShowNotFoundException(Long showId) {
        super(RejectionReason.SHOW_NOT_FOUND, "Show not found: " + showId);
    }
}
