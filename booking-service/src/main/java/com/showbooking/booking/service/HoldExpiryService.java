package com.showbooking.booking.service;

public interface HoldExpiryService {

    /**
     * Return an expired hold's seat to AVAILABLE and cancel its transaction, in one
     * database transaction.
     *
     * @param holdToken Token of a hold believed to be past its deadline
     * @return true if this call reclaimed the hold; false if it was not HELD or not
     *         yet expired (a confirm or release got there first)
     * @throws IllegalStateException if the seat does not carry the hold, after rollback
     */
    boolean expireHold(String holdToken);
}
