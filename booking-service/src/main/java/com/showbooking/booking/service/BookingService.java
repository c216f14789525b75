package com.showbooking.booking.service;

import com.showbooking.booking.repository.BookingTransactionRepository;
import com.showbooking.booking.repository.SeatRepository;
import com.showbooking.booking.repository.ShowRepository;
import com.showbooking.common.dto.BookingDto;
import com.showbooking.common.dto.SeatDto;
import com.showbooking.common.dto.SeatHoldResponse;
import com.showbooking.common.entity.BookingTransaction;
import com.showbooking.common.entity.Seat;
import com.showbooking.common.util.SeatLabels;
import com.showbooking.common.util.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Seat hold, confirm and release. Each transition is a conditional update on the
 * expected status; the seat and its booking transaction change in the same database
 * transaction. Confirm and release touch the transaction row before the seat row,
 * as the reclaimer does.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BookingService implements ReservationStore {

    private final SeatRepository seatRepository;
    private final ShowRepository showRepository;
    private final BookingTransactionRepository transactionRepository;
    private final HoldExpiryService holdExpiryService;
    private final SeatHoldGate seatHoldGate;
    private final EventMessagingService messagingService;
    private final Clock clock;

    @Value("${booking.hold.duration.seconds:20}")
    private long holdDurationSeconds;

    @Override
    @Transactional
    public SeatHoldResponse tryHold(Long showId, String seatLabel, String customerName) {
        String label = SeatLabels.normalize(seatLabel);

        Seat seat = seatRepository.findByShowIdAndLabel(showId, label)
            .orElseThrow(() -> missingSeat(showId, label));

        String holdToken = TokenGenerator.generateHoldToken();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(holdDurationSeconds);

        // 1. Redis gate turns away most contenders before they reach the database
        if (!seatHoldGate.tryAcquire(showId, label, holdToken, Duration.ofSeconds(holdDurationSeconds))) {
            log.warn("Seat hold rejected by gate: show={} seat={}", showId, label);
            throw new SeatUnavailableException(showId, label);
        }

        try {
            // 2. AVAILABLE -> HELD; the database is the authority
            int held = seatRepository.holdIfAvailable(seat.getId(), holdToken, expiresAt, customerName, now);
            if (held == 0) {
                log.warn("Seat hold rejected: show={} seat={} is not available", showId, label);
                throw new SeatUnavailableException(showId, label);
            }

            // 3. Booking transaction with the same token and deadline
            BookingTransaction transaction = BookingTransaction.builder()
                .token(holdToken)
                .seat(seatRepository.getReferenceById(seat.getId()))
                .customerName(customerName)
                .status(BookingTransaction.TransactionStatus.HELD)
                .holdExpiresAt(expiresAt)
                .build();

            transaction = transactionRepository.save(transaction);

            BookingDto holdDto = convertToDto(transaction, showId, label);

            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_COMMITTED) {
                        messagingService.publishSeatHoldCreated(holdDto);
                    } else {
                        seatHoldGate.release(showId, label, holdToken);
                        log.warn("Seat hold rolled back for show={} seat={}, gate released", showId, label);
                    }
                }
            });

            log.info("Seat hold created: token={} show={} seat={} by={} expiresAt={}",
                    holdToken, showId, label, customerName, expiresAt);

            return SeatHoldResponse.builder()
                .holdToken(holdToken)
                .showId(showId)
                .seatLabel(label)
                .customerName(customerName)
                .expiresAt(expiresAt)
                .timeRemainingSeconds(Duration.between(now, expiresAt).getSeconds())
                .status(holdDto.getStatus())
                .message("Seat " + label + " held. Confirm within " + holdDurationSeconds + " seconds.")
                .build();

        } catch (RuntimeException e) {
            seatHoldGate.release(showId, label, holdToken);
            throw e;
        }
    }

    @Override
    @Transactional
    public BookingDto confirm(String holdToken) {
        LocalDateTime now = LocalDateTime.now(clock);

        BookingTransaction transaction = transactionRepository.findByTokenWithSeat(holdToken)
            .filter(BookingTransaction::isHeld)
            .orElseThrow(() -> new HoldNotFoundException(holdToken));

        // Judged against the deadline itself, whether or not the reclaimer got there first
        if (transaction.isExpiredAt(now)) {
            log.warn("Confirm rejected: hold {} expired at {}", holdToken, transaction.getHoldExpiresAt());
            throw new HoldExpiredException(holdToken, transaction.getHoldExpiresAt());
        }

        Seat seat = transaction.getSeat();
        Long seatId = seat.getId();
        Long showId = seat.getShow().getId();
        String label = seat.getLabel();
        BookingDto bookingDto = convertToDto(transaction, showId, label);

        // 1. Transaction row: HELD -> CONFIRMED while still inside the deadline
        if (transactionRepository.confirmIfActive(holdToken, now) == 0) {
            log.warn("Confirm lost race for hold {}: no longer HELD", holdToken);
            throw new HoldNotFoundException(holdToken);
        }

        // 2. Seat row: HELD under this token -> BOOKED
        int booked = seatRepository.bookIfHeld(seatId, holdToken, transaction.getCustomerName(), now);
        if (booked != 1) {
            log.error("Seat {} of show {} is not HELD by {} although its transaction is", label, showId, holdToken);
            throw new IllegalStateException("Seat " + label + " is not held by " + holdToken);
        }

        bookingDto.setStatus(BookingTransaction.TransactionStatus.CONFIRMED.name());
        bookingDto.setConfirmedAt(now);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    seatHoldGate.release(showId, label, holdToken);
                    messagingService.publishSeatHoldConfirmed(bookingDto);
                } else {
                    log.warn("Booking confirmation rolled back for hold={}", holdToken);
                }
            }
        });

        log.info("Booking confirmed: token={} show={} seat={} by={}",
                holdToken, showId, label, bookingDto.getCustomerName());

        return bookingDto;
    }

    @Override
    @Transactional
    public void release(String holdToken) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<BookingTransaction> found = transactionRepository.findByTokenWithSeat(holdToken)
            .filter(BookingTransaction::isHeld);

        if (found.isEmpty()) {
            log.debug("Release ignored: hold {} is unknown or already ended", holdToken);
            throw new HoldNotFoundException(holdToken);
        }

        BookingTransaction transaction = found.get();
        Seat seat = transaction.getSeat();
        Long seatId = seat.getId();
        Long showId = seat.getShow().getId();
        String label = seat.getLabel();
        BookingDto holdDto = convertToDto(transaction, showId, label);

        // 1. Transaction row: HELD -> CANCELLED, deadline irrelevant
        if (transactionRepository.cancelIfHeld(holdToken, BookingTransaction.CancellationReason.RELEASED, now) == 0) {
            log.debug("Release ignored: hold {} ended concurrently", holdToken);
            throw new HoldNotFoundException(holdToken);
        }

        // 2. Seat row: HELD under this token -> AVAILABLE
        int released = seatRepository.releaseIfHeld(seatId, holdToken, now);
        if (released != 1) {
            log.error("Seat {} of show {} is not HELD by {} although its transaction is", label, showId, holdToken);
            throw new IllegalStateException("Seat " + label + " is not held by " + holdToken);
        }

        holdDto.setStatus(BookingTransaction.TransactionStatus.CANCELLED.name());
        holdDto.setCancellationReason(BookingTransaction.CancellationReason.RELEASED.name());
        holdDto.setCancelledAt(now);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    seatHoldGate.release(showId, label, holdToken);
                    messagingService.publishSeatHoldCancelled(holdDto);
                } else {
                    log.warn("Seat hold release rolled back for hold={}", holdToken);
                }
            }
        });

        log.info("Seat hold released: token={} show={} seat={}", holdToken, showId, label);
    }

    /**
     * Expired holds of the show are reclaimed before the read, each in its own
     * transaction, so a seat is never listed as HELD past its deadline.
     */
    @Override
    public List<SeatDto> listSeats(Long showId) {
        reclaimExpiredHolds(showId);

        List<Seat> seats = seatRepository.findByShowId(showId);

        if (seats.isEmpty() && !showRepository.existsById(showId)) {
            throw new ShowNotFoundException(showId);
        }

        return seats.stream()
            .sorted(Comparator.comparing(Seat::getLabel, SeatLabels.NATURAL_ORDER))
            .map(seat -> convertToDto(seat, showId))
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BookingDto> getHold(String holdToken) {
        return transactionRepository.findByTokenWithSeat(holdToken)
            .map(transaction -> convertToDto(
                transaction,
                transaction.getSeat().getShow().getId(),
                transaction.getSeat().getLabel()));
    }

    private void reclaimExpiredHolds(Long showId) {
        List<String> expiredTokens =
            transactionRepository.findExpiredHoldTokensForShow(showId, LocalDateTime.now(clock));

        for (String holdToken : expiredTokens) {
            try {
                holdExpiryService.expireHold(holdToken);
            } catch (RuntimeException e) {
                // The reclaim job retries it; the listing still shows the seat as it is stored
                log.warn("Could not reclaim expired hold {} before listing seats: {}", holdToken, e.getMessage());
            }
        }
    }

    private BookingException missingSeat(Long showId, String label) {
        if (!showRepository.existsById(showId)) {
            return new ShowNotFoundException(showId);
        }
        return new SeatNotFoundException(showId, label);
    }

    // DTO conversion methods
    private BookingDto convertToDto(BookingTransaction transaction, Long showId, String seatLabel) {
        return BookingDto.builder()
            .holdToken(transaction.getToken())
            .showId(showId)
            .seatLabel(seatLabel)
            .customerName(transaction.getCustomerName())
            .status(transaction.getStatus().name())
            .cancellationReason(transaction.getCancellationReason() != null
                ? transaction.getCancellationReason().name() : null)
            .holdExpiresAt(transaction.getHoldExpiresAt())
            .createdAt(transaction.getCreatedAt())
            .confirmedAt(transaction.getConfirmedAt())
            .cancelledAt(transaction.getCancelledAt())
            .build();
    }

    private SeatDto convertToDto(Seat seat, Long showId) {
        return SeatDto.builder()
            .id(seat.getId())
            .showId(showId)
            .label(seat.getLabel())
            .rowLetter(seat.getRowLetter())
            .seatNumber(seat.getSeatNumber())
            .status(seat.getStatus().name())
            .holdExpiresAt(seat.getHoldExpiresAt())
            .bookedByName(seat.getBookedByName())
            .bookedAt(seat.getBookedAt())
            .build();
    }
}
