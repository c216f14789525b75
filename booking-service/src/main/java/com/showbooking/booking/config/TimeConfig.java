package com.showbooking.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    /**
     * Single time source for hold deadlines, confirm checks and the reclaimer.
     */
    @Bean
    public Clock bookingClock(@Value("${booking.time-zone:UTC}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }

    /**
     * Shared by the @Scheduled reclaimer and client-side hold countdowns.
     */
    @Bean
    public TaskScheduler taskScheduler(
            @Value("${booking.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("booking-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
