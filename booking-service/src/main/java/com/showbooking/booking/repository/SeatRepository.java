package com.showbooking.booking.repository;

import com.showbooking.common.entity.Seat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SeatRepository extends JpaRepository<Seat, Long> {

    /**
     * All seats of a show, unordered
     */
    List<Seat> findByShowId(Long showId);

    /**
     * Find seat by show and label (unique constraint)
     */
    Optional<Seat> findByShowIdAndLabel(Long showId, String label);

    /**
     * Count seats of a show in a given status
     */
    long countByShowIdAndStatus(Long showId, Seat.SeatStatus status);

    /**
     * AVAILABLE -> HELD as one conditional update.
     * Returns 0 when the seat was not AVAILABLE at the moment of the write.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Seat s SET s.status = 'HELD', " +
           "s.holdToken = :holdToken, s.holdExpiresAt = :expiresAt, s.heldBy = :heldBy, " +
           "s.updatedAt = :now " +
           "WHERE s.id = :seatId AND s.status = 'AVAILABLE'")
    int holdIfAvailable(@Param("seatId") Long seatId,
                        @Param("holdToken") String holdToken,
                        @Param("expiresAt") LocalDateTime expiresAt,
                        @Param("heldBy") String heldBy,
                        @Param("now") LocalDateTime now);

    /**
     * HELD -> BOOKED, only for the hold identified by the token.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Seat s SET s.status = 'BOOKED', " +
           "s.bookedByName = :bookedByName, s.bookedAt = :now, " +
           "s.holdToken = NULL, s.holdExpiresAt = NULL, s.heldBy = NULL, " +
           "s.updatedAt = :now " +
           "WHERE s.id = :seatId AND s.status = 'HELD' AND s.holdToken = :holdToken")
    int bookIfHeld(@Param("seatId") Long seatId,
                   @Param("holdToken") String holdToken,
                   @Param("bookedByName") String bookedByName,
                   @Param("now") LocalDateTime now);

    /**
     * HELD -> AVAILABLE, only for the hold identified by the token.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Seat s SET s.status = 'AVAILABLE', " +
           "s.holdToken = NULL, s.holdExpiresAt = NULL, s.heldBy = NULL, " +
           "s.updatedAt = :now " +
           "WHERE s.id = :seatId AND s.status = 'HELD' AND s.holdToken = :holdToken")
    int releaseIfHeld(@Param("seatId") Long seatId,
                      @Param("holdToken") String holdToken,
                      @Param("now") LocalDateTime now);
}
