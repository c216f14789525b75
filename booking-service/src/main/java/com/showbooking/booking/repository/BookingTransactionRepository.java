package com.showbooking.booking.repository;

import com.showbooking.common.entity.BookingTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingTransactionRepository extends JpaRepository<BookingTransaction, Long> {

    /**
     * Find transaction by token, with its seat and show loaded for DTO conversion
     */
    @Query("SELECT t FROM BookingTransaction t JOIN FETCH t.seat s JOIN FETCH s.show " +
           "WHERE t.token = :token")
    Optional<BookingTransaction> findByTokenWithSeat(@Param("token") String token);

    /**
     * HELD -> CONFIRMED while the deadline has not passed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BookingTransaction t SET t.status = 'CONFIRMED', t.confirmedAt = :now " +
           "WHERE t.token = :token AND t.status = 'HELD' AND t.holdExpiresAt > :now")
    int confirmIfActive(@Param("token") String token, @Param("now") LocalDateTime now);

    /**
     * HELD -> CANCELLED regardless of deadline (voluntary release).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BookingTransaction t SET t.status = 'CANCELLED', t.cancelledAt = :now, " +
           "t.cancellationReason = :reason " +
           "WHERE t.token = :token AND t.status = 'HELD'")
    int cancelIfHeld(@Param("token") String token,
                     @Param("reason") BookingTransaction.CancellationReason reason,
                     @Param("now") LocalDateTime now);

    /**
     * HELD -> CANCELLED only once the deadline has passed (reclaimer).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BookingTransaction t SET t.status = 'CANCELLED', t.cancelledAt = :now, " +
           "t.cancellationReason = :reason " +
           "WHERE t.token = :token AND t.status = 'HELD' AND t.holdExpiresAt <= :now")
    int cancelIfExpired(@Param("token") String token,
                        @Param("reason") BookingTransaction.CancellationReason reason,
                        @Param("now") LocalDateTime now);

    /**
     * Tokens of HELD transactions whose deadline has passed, oldest first
     */
    @Query("SELECT t.token FROM BookingTransaction t WHERE t.status = 'HELD' " +
           "AND t.holdExpiresAt <= :now ORDER BY t.holdExpiresAt")
    List<String> findExpiredHoldTokens(@Param("now") LocalDateTime now);

    /**
     * Same as {@link #findExpiredHoldTokens}, limited to one show
     */
    @Query("SELECT t.token FROM BookingTransaction t WHERE t.seat.show.id = :showId " +
           "AND t.status = 'HELD' AND t.holdExpiresAt <= :now ORDER BY t.holdExpiresAt")
    List<String> findExpiredHoldTokensForShow(@Param("showId") Long showId, @Param("now") LocalDateTime now);
}
