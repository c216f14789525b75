package com.showbooking.booking.service;

import lombok.Getter;

/**
 * Base class for reservation rejections. A rejection means no state changed.
 */
@Getter
public class BookingException extends RuntimeException {

    private final RejectionReason reason;

    public BookingException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public enum RejectionReason {
        SEAT_UNAVAILABLE,
        HOLD_NOT_FOUND,
        HOLD_EXPIRED,
        SHOW_NOT_FOUND,
        SEAT_NOT_FOUND
    }
}
