package com.showbooking.booking.service;

import java.time.Duration;

/**
 * Fast pre-check in front of the database hold. Acquiring the gate never grants a
 * seat on its own; the conditional database update decides.
 */
public interface SeatHoldGate {

    /**
     * Try to claim the seat for a hold token
     *
     * @param showId Show owning the seat
     * @param seatLabel Normalized seat label
     * @param holdToken Token of the hold being created
     * @param ttl How long the claim lives without an explicit release
     * @return false if another hold already claimed the seat
     */
    boolean tryAcquire(Long showId, String seatLabel, String holdToken, Duration ttl);

    /**
     * Drop the claim, only if it still belongs to the given hold token
     */
    void release(Long showId, String seatLabel, String holdToken);

    /**
     * Key pattern: seat:{showId}:{label}:HELD
     */
    static String seatHoldKey(Long showId, String seatLabel) {
        return String.format("seat:%d:%s:HELD", showId, seatLabel);
    }
}
