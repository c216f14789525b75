package com.showbooking.common.util;

import java.util.UUID;

public final class TokenGenerator {

    private static final String HOLD_PREFIX = "HOLD_";

    private TokenGenerator() {
    }

    /**
     * Generate a unique hold token. The same value identifies the booking transaction
     * and marks the seat it holds.
     */
    public static String generateHoldToken() {
        return HOLD_PREFIX + UUID.randomUUID().toString().replace("-", "").toUpperCase();
    }
}
