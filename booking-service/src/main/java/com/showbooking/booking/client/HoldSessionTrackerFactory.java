package com.showbooking.booking.client;

import com.showbooking.booking.service.ReservationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * One tracker per requesting party; trackers share the store, clock and scheduler.
 */
@Component
@RequiredArgsConstructor
public class HoldSessionTrackerFactory {

    private final ReservationStore reservationStore;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    public HoldSessionTracker newTracker() {
        return new HoldSessionTracker(reservationStore, clock, taskScheduler);
    }

    public HoldSessionTracker newTracker(HoldSessionListener listener) {
        HoldSessionTracker tracker = newTracker();
        tracker.addListener(listener);
        return tracker;
    }
}
