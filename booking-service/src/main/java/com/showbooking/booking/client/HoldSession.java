package com.showbooking.booking.client;

import lombok.*;

import java.time.LocalDateTime;

/**
 * Local view of one seat hold. Seat label, token and expiry are the values a caller
 * keeps across restarts to resume or release the hold later.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class HoldSession {

    private final Long showId;
    private final String seatLabel;
    private final String holdToken;
    private final String customerName;
    private final LocalDateTime expiresAt;

    @Setter(AccessLevel.PACKAGE)
    @Builder.Default
    private volatile State state = State.HELD;

    public enum State {
        HELD, CONFIRMED, CANCELLED, EXPIRED
    }

    public boolean isActive() {
        return state == State.HELD;
    }

    /**
     * A hold restored from values the caller saved earlier
     */
    public static HoldSession saved(Long showId, String seatLabel, String holdToken, LocalDateTime expiresAt) {
        return HoldSession.builder()
            .showId(showId)
            .seatLabel(seatLabel)
            .holdToken(holdToken)
            .expiresAt(expiresAt)
            .build();
    }
}
