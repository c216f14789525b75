package com.showbooking.booking.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Gate used when Redis is switched off: every request goes straight to the database.
 */
@Service
@Slf4j
@ConditionalOnProperty(value = "booking.hold.gate.enabled", havingValue = "false")
public class NoOpSeatHoldGate implements SeatHoldGate {

    public NoOpSeatHoldGate() {
        log.info("Redis seat gate disabled; holds are serialized by the database only");
    }

    @Override
    public boolean tryAcquire(Long showId, String seatLabel, String holdToken, Duration ttl) {
        return true;
    }

    @Override
    public void release(Long showId, String seatLabel, String holdToken) {
        // nothing claimed
    }
}
