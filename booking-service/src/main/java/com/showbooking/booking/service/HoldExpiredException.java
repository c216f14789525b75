package com.showbooking.booking.service;

import java.time.LocalDateTime;

public class HoldExpiredException extends BookingException {

    public HoldExpiredException(String holdToken, LocalDateTime expiredAt) {
        super(RejectionReason.HOLD_EXPIRED, "Hold " + holdToken + " expired at " + expiredAt);
    }
}
