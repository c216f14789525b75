package com.showbooking.booking.service;

import com.showbooking.booking.repository.BookingTransactionRepository;
import com.showbooking.booking.repository.SeatRepository;
import com.showbooking.common.dto.BookingDto;
import com.showbooking.common.entity.BookingTransaction;
import com.showbooking.common.entity.Seat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultHoldExpiryService implements HoldExpiryService {

    private final BookingTransactionRepository transactionRepository;
    private final SeatRepository seatRepository;
    private final SeatHoldGate seatHoldGate;
    private final EventMessagingService messagingService;
    private final Clock clock;

    @Override
    @Transactional
    public boolean expireHold(String holdToken) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<BookingTransaction> found = transactionRepository.findByTokenWithSeat(holdToken);

        if (found.isEmpty()) {
            log.debug("Hold not found in database: {} (may have been already processed)", holdToken);
            return false;
        }

        BookingTransaction transaction = found.get();

        if (!transaction.isHeld()) {
            log.debug("Hold {} is not HELD (status: {}), skipping expiry", holdToken, transaction.getStatus());
            return false;
        }

        if (!transaction.isExpiredAt(now)) {
            log.debug("Hold {} not yet expired. Expires at: {}, now: {}",
                    holdToken, transaction.getHoldExpiresAt(), now);
            return false;
        }

        Seat seat = transaction.getSeat();
        Long seatId = seat.getId();
        Long showId = seat.getShow().getId();
        String label = seat.getLabel();

        // 1. Transaction row: HELD and past deadline -> CANCELLED(EXPIRED)
        int cancelled = transactionRepository.cancelIfExpired(
            holdToken, BookingTransaction.CancellationReason.EXPIRED, now);
        if (cancelled == 0) {
            log.debug("Hold {} ended concurrently, nothing to reclaim", holdToken);
            return false;
        }

        // 2. Seat row: HELD under this token -> AVAILABLE
        int released = seatRepository.releaseIfHeld(seatId, holdToken, now);
        if (released != 1) {
            log.error("Seat {} of show {} is not HELD by expired hold {}; rolling back", label, showId, holdToken);
            throw new IllegalStateException("Seat " + label + " is not held by " + holdToken);
        }

        BookingDto expiredDto = BookingDto.builder()
            .holdToken(holdToken)
            .showId(showId)
            .seatLabel(label)
            .customerName(transaction.getCustomerName())
            .status(BookingTransaction.TransactionStatus.CANCELLED.name())
            .cancellationReason(BookingTransaction.CancellationReason.EXPIRED.name())
            .holdExpiresAt(transaction.getHoldExpiresAt())
            .createdAt(transaction.getCreatedAt())
            .cancelledAt(now)
            .build();

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    seatHoldGate.release(showId, label, holdToken);
                    messagingService.publishSeatHoldExpired(expiredDto);
                } else {
                    log.warn("Hold expiry rolled back for hold={}", holdToken);
                }
            }
        });

        log.info("Expired hold reclaimed: token={} show={} seat={} expiredAt={}",
                holdToken, showId, label, transaction.getHoldExpiresAt());
        return true;
    }
}
