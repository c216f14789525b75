package com.showbooking.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "booking_transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_booking_tx_token", columnNames = "token")
    },
    indexes = {
        @Index(name = "idx_booking_tx_status_expiry", columnList = "status, hold_expires_at"),
        @Index(name = "idx_booking_tx_seat", columnList = "seat_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "seat")
public class BookingTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 100)
    @Column(nullable = false, updatable = false)
    private String token; // Same value as Seat.holdToken while HELD

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "seat_id", nullable = false, updatable = false)
    private Seat seat;

    @NotBlank
    @Size(max = 100)
    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @NotNull
    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private TransactionStatus status;

    @NotNull
    @Column(name = "hold_expires_at", nullable = false)
    private LocalDateTime holdExpiresAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "cancellation_reason")
    @Enumerated(EnumType.STRING)
    private CancellationReason cancellationReason;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum TransactionStatus {
        HELD, CONFIRMED, CANCELLED
    }

    public enum CancellationReason {
        RELEASED, EXPIRED
    }

    // Helper methods
    public boolean isHeld() {
        return status == TransactionStatus.HELD;
    }

    public boolean isTerminal() {
        return status == TransactionStatus.CONFIRMED || status == TransactionStatus.CANCELLED;
    }

    /**
     * Deadline comparison shared by confirm and the reclaimer: a hold is expired
     * from the instant {@code now} reaches {@code holdExpiresAt}.
     */
    public boolean isExpiredAt(LocalDateTime now) {
        return !now.isBefore(holdExpiresAt);
    }
}
