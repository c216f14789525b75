package com.showbooking.booking.client;

/**
 * Notified once per session when it leaves HELD. {@link HoldSession#getState()} tells
 * why: CONFIRMED, CANCELLED or EXPIRED.
 */
@FunctionalInterface
public interface HoldSessionListener {

    void onSessionEnded(HoldSession session);
}
