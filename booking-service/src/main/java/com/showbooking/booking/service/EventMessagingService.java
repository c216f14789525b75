package com.showbooking.booking.service;

import com.showbooking.common.dto.BookingDto;

/**
 * Outbound notifications of booking transaction transitions. Implementations must
 * never throw: a failed publish does not undo a committed reservation.
 */
public interface EventMessagingService {

    void publishSeatHoldCreated(BookingDto hold);

    void publishSeatHoldConfirmed(BookingDto booking);

    void publishSeatHoldCancelled(BookingDto hold);

    void publishSeatHoldExpired(BookingDto hold);
}
