package com.showbooking.booking.client;

public enum ResumeOutcome {
    /** The store still holds the seat under the saved token; countdown restarted. */
    RESUMED,
    /** Expired, reclaimed, released or booked meanwhile; local state dropped. */
    DISCARDED
}
