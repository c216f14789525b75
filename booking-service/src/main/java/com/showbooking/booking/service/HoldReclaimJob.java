package com.showbooking.booking.service;

import com.showbooking.booking.repository.BookingTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Periodic sweep returning seats of abandoned holds to AVAILABLE.
 *
 * Each hold is reclaimed in its own transaction, so one failure neither rolls back
 * nor blocks the others. A late or skipped sweep only delays availability: confirm
 * already rejects holds past their deadline on its own.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "booking.hold.reclaim.enabled", havingValue = "true", matchIfMissing = true)
public class HoldReclaimJob {

    private final BookingTransactionRepository transactionRepository;
    private final HoldExpiryService holdExpiryService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${booking.hold.reclaim.interval.ms:5000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return number of holds reclaimed by this sweep
     */
    public int sweep() {
        List<String> expiredTokens = transactionRepository.findExpiredHoldTokens(LocalDateTime.now(clock));

        if (expiredTokens.isEmpty()) {
            return 0;
        }

        log.debug("Reclaim sweep: found {} expired holds", expiredTokens.size());

        int reclaimed = 0;
        for (String holdToken : expiredTokens) {
            try {
                if (holdExpiryService.expireHold(holdToken)) {
                    reclaimed++;
                }
            } catch (Exception e) {
                log.error("Failed to reclaim hold: {}", holdToken, e);
            }
        }

        if (reclaimed > 0) {
            log.info("Reclaim sweep: returned {} seats to availability", reclaimed);
        }
        return reclaimed;
    }
}
