package com.showbooking.booking.service;

import com.showbooking.booking.repository.BookingTransactionRepository;
import com.showbooking.booking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HoldReclaimJobTest {

    @Mock
    private BookingTransactionRepository transactionRepository;

    @Mock
    private HoldExpiryService holdExpiryService;

    private final MutableClock clock = new MutableClock();

    private HoldReclaimJob reclaimJob;

    @BeforeEach
    void setUp() {
        reclaimJob = new HoldReclaimJob(transactionRepository, holdExpiryService, clock);
    }

    @Test
    void sweep_NothingExpired_ReturnsZero() {
        when(transactionRepository.findExpiredHoldTokens(LocalDateTime.now(clock))).thenReturn(List.of());

        assertEquals(0, reclaimJob.sweep());
        verifyNoInteractions(holdExpiryService);
    }

    @Test
    void sweep_ReclaimsEachExpiredHold() {
        when(transactionRepository.findExpiredHoldTokens(LocalDateTime.now(clock)))
            .thenReturn(List.of("HOLD_1", "HOLD_2", "HOLD_3"));
        when(holdExpiryService.expireHold("HOLD_1")).thenReturn(true);
        when(holdExpiryService.expireHold("HOLD_2")).thenReturn(false);
        when(holdExpiryService.expireHold("HOLD_3")).thenReturn(true);

        assertEquals(2, reclaimJob.sweep());
    }

    @Test
    void sweep_OneFailure_DoesNotStopOthers() {
        when(transactionRepository.findExpiredHoldTokens(LocalDateTime.now(clock)))
            .thenReturn(List.of("HOLD_1", "HOLD_2", "HOLD_3"));
        when(holdExpiryService.expireHold("HOLD_1")).thenReturn(true);
        when(holdExpiryService.expireHold("HOLD_2")).thenThrow(new IllegalStateException("seat mismatch"));
        when(holdExpiryService.expireHold("HOLD_3")).thenReturn(true);

        assertEquals(2, reclaimJob.sweep());
        verify(holdExpiryService).expireHold("HOLD_3");
    }

    @Test
    void scheduledSweep_DelegatesToSweep() {
        when(transactionRepository.findExpiredHoldTokens(LocalDateTime.now(clock))).thenReturn(List.of("HOLD_1"));
        when(holdExpiryService.expireHold("HOLD_1")).thenReturn(true);

        reclaimJob.scheduledSweep();

        verify(holdExpiryService).expireHold("HOLD_1");
    }
}
