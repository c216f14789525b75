package com.showbooking.booking.client;

import com.showbooking.booking.service.HoldExpiredException;
import com.showbooking.booking.service.HoldNotFoundException;
import com.showbooking.booking.service.ReservationStore;
import com.showbooking.common.dto.BookingDto;
import com.showbooking.common.dto.SeatHoldResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives the hold lifecycle for one requesting party: at most one active hold, a
 * local countdown to the store's deadline, and an early release once it runs out.
 *
 * The store stays authoritative. The countdown only decides when confirm and cancel
 * stop being offered; the store rejects late confirms by itself.
 */
@Slf4j
public class HoldSessionTracker {

    private final ReservationStore reservationStore;
    private final Clock clock;
    private final TaskScheduler taskScheduler;
    private final List<HoldSessionListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private HoldSession session;
    private ScheduledFuture<?> countdown;
    private boolean pending; // a hold or resume is waiting on the store

    public HoldSessionTracker(ReservationStore reservationStore, Clock clock, TaskScheduler taskScheduler) {
        this.reservationStore = reservationStore;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
    }

    public void addListener(HoldSessionListener listener) {
        listeners.add(listener);
    }

    /**
     * Hold a seat and start the countdown
     *
     * @throws IllegalStateException if this party already has an active hold or one in progress
     */
    public HoldSession hold(Long showId, String seatLabel, String customerName) {
        reserveSlot();
        try {
            SeatHoldResponse response = reservationStore.tryHold(showId, seatLabel, customerName);

            HoldSession held = HoldSession.builder()
                .showId(response.getShowId())
                .seatLabel(response.getSeatLabel())
                .holdToken(response.getHoldToken())
                .customerName(response.getCustomerName())
                .expiresAt(response.getExpiresAt())
                .build();

            start(held);
            log.info("Holding seat {} of show {} until {}", held.getSeatLabel(), held.getShowId(), held.getExpiresAt());
            return held;
        } finally {
            freeSlot();
        }
    }

    /**
     * Whole seconds until the active hold expires; 0 without one, never negative
     */
    public synchronized long timeRemaining() {
        if (session == null || !session.isActive()) {
            return 0;
        }
        long seconds = Duration.between(LocalDateTime.now(clock), session.getExpiresAt()).getSeconds();
        return Math.max(0, seconds);
    }

    /**
     * True while a hold is active and its deadline has not passed locally
     */
    public synchronized boolean canConfirm() {
        return session != null
            && session.isActive()
            && LocalDateTime.now(clock).isBefore(session.getExpiresAt());
    }

    public synchronized Optional<HoldSession> currentSession() {
        return Optional.ofNullable(session);
    }

    /**
     * Book the held seat
     *
     * @throws IllegalStateException if no hold is active or it has expired locally
     */
    public BookingDto confirm() {
        HoldSession current = requireConfirmable();

        try {
            BookingDto booking = reservationStore.confirm(current.getHoldToken());
            end(current, HoldSession.State.CONFIRMED);
            return booking;
        } catch (HoldExpiredException e) {
            end(current, HoldSession.State.EXPIRED);
            throw e;
        } catch (HoldNotFoundException e) {
            end(current, HoldSession.State.CANCELLED);
            throw e;
        }
    }

    /**
     * Give the held seat back
     *
     * @throws IllegalStateException if no hold is active or it has expired locally
     */
    public void cancel() {
        HoldSession current = requireConfirmable();

        try {
            reservationStore.release(current.getHoldToken());
        } catch (HoldNotFoundException e) {
            end(current, HoldSession.State.CANCELLED);
            throw e;
        }
        end(current, HoldSession.State.CANCELLED);
    }

    /**
     * Reconcile a saved hold with the store after a restart. The countdown resumes
     * from the store's deadline only if the same seat is still HELD under the saved
     * token and that deadline is in the future.
     *
     * @throws IllegalStateException if this party already has an active hold or one in progress
     */
    public ResumeOutcome resume(HoldSession saved) {
        reserveSlot();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            Optional<BookingDto> stillHeld = reservationStore.getHold(saved.getHoldToken())
                .filter(BookingDto::isHeld)
                .filter(hold -> Objects.equals(hold.getShowId(), saved.getShowId()))
                .filter(hold -> Objects.equals(hold.getSeatLabel(), saved.getSeatLabel()))
                .filter(hold -> now.isBefore(hold.getHoldExpiresAt()));

            if (stillHeld.isEmpty()) {
                log.info("Discarding saved hold {} for seat {}: no longer active", saved.getHoldToken(), saved.getSeatLabel());
                discard();
                return ResumeOutcome.DISCARDED;
            }

            BookingDto hold = stillHeld.get();
            HoldSession resumed = saved.toBuilder()
                .customerName(hold.getCustomerName())
                .expiresAt(hold.getHoldExpiresAt())
                .state(HoldSession.State.HELD)
                .build();

            start(resumed);
            log.info("Resumed hold {} for seat {} until {}", resumed.getHoldToken(), resumed.getSeatLabel(), resumed.getExpiresAt());
            return ResumeOutcome.RESUMED;
        } finally {
            freeSlot();
        }
    }

    /**
     * Forget local state without touching the store
     */
    public synchronized void discard() {
        cancelCountdown();
        session = null;
    }

    private synchronized void reserveSlot() {
        if (pending) {
            throw new IllegalStateException("Another hold is already in progress");
        }
        if (session != null && session.isActive()) {
            throw new IllegalStateException("Seat " + session.getSeatLabel() + " is already held");
        }
        pending = true;
    }

    private synchronized void freeSlot() {
        pending = false;
    }

    private synchronized void start(HoldSession held) {
        cancelCountdown();
        session = held;
        countdown = taskScheduler.schedule(
            () -> onLocalDeadline(held),
            held.getExpiresAt().atZone(clock.getZone()).toInstant());
    }

    private synchronized HoldSession requireConfirmable() {
        if (session == null || !session.isActive()) {
            throw new IllegalStateException("No active hold");
        }
        if (!LocalDateTime.now(clock).isBefore(session.getExpiresAt())) {
            throw new IllegalStateException("Hold on seat " + session.getSeatLabel() + " has expired");
        }
        return session;
    }

    void onLocalDeadline(HoldSession expired) {
        synchronized (this) {
            if (session != expired || !expired.isActive()) {
                return;
            }
            expired.setState(HoldSession.State.EXPIRED);
            countdown = null;
        }

        log.info("Hold on seat {} of show {} ran out", expired.getSeatLabel(), expired.getShowId());
        notifyListeners(expired);

        // Free the seat now rather than waiting for the reclaimer
        try {
            reservationStore.release(expired.getHoldToken());
        } catch (HoldNotFoundException e) {
            log.debug("Expired hold {} already ended in the store", expired.getHoldToken());
        } catch (RuntimeException e) {
            log.warn("Early release of expired hold {} failed, the reclaimer will free it: {}",
                    expired.getHoldToken(), e.getMessage());
        }
    }

    private void end(HoldSession current, HoldSession.State state) {
        synchronized (this) {
            if (session != current) {
                return;
            }
            // The store booked the seat after the countdown ran out; its answer wins
            boolean bookedAfterDeadline = state == HoldSession.State.CONFIRMED
                && current.getState() == HoldSession.State.EXPIRED;
            if (!current.isActive() && !bookedAfterDeadline) {
                return;
            }
            cancelCountdown();
            current.setState(state);
        }
        notifyListeners(current);
    }

    private void notifyListeners(HoldSession ended) {
        for (HoldSessionListener listener : listeners) {
            try {
                listener.onSessionEnded(ended);
            } catch (RuntimeException e) {
                log.warn("Hold session listener failed for {}", ended.getHoldToken(), e);
            }
        }
    }

    private void cancelCountdown() {
        if (countdown != null) {
            countdown.cancel(false);
            countdown = null;
        }
    }
}
