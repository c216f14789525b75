package com.showbooking.booking.service;

/**
 * Unknown token, or the hold already reached CONFIRMED or CANCELLED.
 */
public class HoldNotFoundException extends BookingException {

    public HoldNotFoundException(String holdToken) {
        super(RejectionReason.HOLD_NOT_FOUND, "No active hold found for token: " + holdToken);
    }
}
