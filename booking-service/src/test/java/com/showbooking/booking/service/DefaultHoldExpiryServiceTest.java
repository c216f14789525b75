package com.showbooking.booking.service;

import com.showbooking.booking.repository.BookingTransactionRepository;
import com.showbooking.booking.repository.SeatRepository;
import com.showbooking.booking.support.MutableClock;
import com.showbooking.common.entity.BookingTransaction;
import com.showbooking.common.entity.Seat;
import com.showbooking.common.entity.Show;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultHoldExpiryServiceTest {

    @Mock
    private BookingTransactionRepository transactionRepository;

    @Mock
    private SeatRepository seatRepository;

    @Mock
    private SeatHoldGate seatHoldGate;

    @Mock
    private EventMessagingService messagingService;

    private final MutableClock clock = new MutableClock();

    private DefaultHoldExpiryService expiryService;

    private BookingTransaction transaction;

    @BeforeEach
    void setUp() {
        TransactionSynchronizationManager.initSynchronization();

        expiryService = new DefaultHoldExpiryService(
            transactionRepository, seatRepository, seatHoldGate, messagingService, clock);

        Show show = Show.builder().id(1L).name("Show").seatCount(30).build();
        Seat seat = Seat.builder().id(10L).show(show).rowLetter("A").seatNumber(3).label("A3")
            .status(Seat.SeatStatus.HELD).build();
        transaction = BookingTransaction.builder()
            .token("HOLD_A")
            .seat(seat)
            .customerName("Ada")
            .status(BookingTransaction.TransactionStatus.HELD)
            .holdExpiresAt(LocalDateTime.now(clock).plusSeconds(20))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void expireHold_PastDeadline_ReclaimsSeat() {
        clock.advanceSeconds(21);
        LocalDateTime now = LocalDateTime.now(clock);
        when(transactionRepository.findByTokenWithSeat("HOLD_A")).thenReturn(Optional.of(transaction));
        when(transactionRepository.cancelIfExpired("HOLD_A", BookingTransaction.CancellationReason.EXPIRED, now))
            .thenReturn(1);
        when(seatRepository.releaseIfHeld(10L, "HOLD_A", now)).thenReturn(1);

        assertTrue(expiryService.expireHold("HOLD_A"));

        verify(messagingService, never()).publishSeatHoldExpired(any());
        TransactionSynchronizationManager.getSynchronizations()
            .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));

        verify(seatHoldGate).release(1L, "A3", "HOLD_A");
        verify(messagingService).publishSeatHoldExpired(argThat(dto ->
            "EXPIRED".equals(dto.getCancellationReason()) && "A3".equals(dto.getSeatLabel())));
    }

    @Test
    void expireHold_NotYetExpired_Skips() {
        clock.advanceSeconds(19);
        when(transactionRepository.findByTokenWithSeat("HOLD_A")).thenReturn(Optional.of(transaction));

        assertFalse(expiryService.expireHold("HOLD_A"));

        verify(transactionRepository, never()).cancelIfExpired(anyString(), any(), any());
        verifyNoInteractions(seatRepository, messagingService);
    }

    @Test
    void expireHold_AlreadyConfirmed_Skips() {
        clock.advanceSeconds(30);
        transaction.setStatus(BookingTransaction.TransactionStatus.CONFIRMED);
        when(transactionRepository.findByTokenWithSeat("HOLD_A")).thenReturn(Optional.of(transaction));

        assertFalse(expiryService.expireHold("HOLD_A"));
        verifyNoInteractions(seatRepository);
    }

    @Test
    void expireHold_Unknown_Skips() {
        when(transactionRepository.findByTokenWithSeat("HOLD_X")).thenReturn(Optional.empty());

        assertFalse(expiryService.expireHold("HOLD_X"));
    }

    @Test
    void expireHold_ConcurrentConfirmWon_Skips() {
        clock.advanceSeconds(21);
        when(transactionRepository.findByTokenWithSeat("HOLD_A")).thenReturn(Optional.of(transaction));
        when(transactionRepository.cancelIfExpired(eq("HOLD_A"), any(), any())).thenReturn(0);

        assertFalse(expiryService.expireHold("HOLD_A"));
        verifyNoInteractions(seatRepository);
        assertTrue(TransactionSynchronizationManager.getSynchronizations().isEmpty());
    }

    @Test
    void expireHold_SeatMismatch_ThrowsForRollback() {
        clock.advanceSeconds(21);
        when(transactionRepository.findByTokenWithSeat("HOLD_A")).thenReturn(Optional.of(transaction));
        when(transactionRepository.cancelIfExpired(eq("HOLD_A"), any(), any())).thenReturn(1);
        when(seatRepository.releaseIfHeld(eq(10L), eq("HOLD_A"), any())).thenReturn(0);

        assertThrows(IllegalStateException.class, () -> expiryService.expireHold("HOLD_A"));
        verifyNoInteractions(messagingService);
    }
}
