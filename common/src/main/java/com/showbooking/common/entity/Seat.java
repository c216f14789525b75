package com.showbooking.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "seats",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_seat_show_label", columnNames = {"show_id", "label"})
    },
    indexes = {
        @Index(name = "idx_seat_show_row_number", columnList = "show_id, row_letter, seat_number"),
        @Index(name = "idx_seat_status", columnList = "status"),
        @Index(name = "idx_seat_hold_token", columnList = "hold_token")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "show")
public class Seat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "show_id", nullable = false)
    private Show show;

    @NotBlank
    @Size(max = 10)
    @Column(name = "row_letter", nullable = false)
    private String rowLetter; // A, B, ... Z, AA, AB

    @NotNull
    @Positive
    @Column(name = "seat_number", nullable = false)
    private Integer seatNumber;

    @NotBlank
    @Size(max = 20)
    @Column(nullable = false)
    private String label; // rowLetter + seatNumber, e.g. A10

    @NotNull
    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private SeatStatus status;

    @Size(max = 100)
    @Column(name = "hold_token")
    private String holdToken;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Size(max = 100)
    @Column(name = "held_by")
    private String heldBy;

    @Size(max = 100)
    @Column(name = "booked_by_name")
    private String bookedByName;

    @Column(name = "booked_at")
    private LocalDateTime bookedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public enum SeatStatus {
        AVAILABLE, HELD, BOOKED
    }

    // Helper methods
    public boolean isAvailable() {
        return status == SeatStatus.AVAILABLE;
    }

    public boolean isHeld() {
        return status == SeatStatus.HELD;
    }

    public boolean isBooked() {
        return status == SeatStatus.BOOKED;
    }

    /**
     * True when the hold/booking columns match the status: AVAILABLE carries neither,
     * HELD carries only hold columns, BOOKED carries only booking columns.
     */
    public boolean hasConsistentShape() {
        boolean holdSet = holdToken != null && holdExpiresAt != null && heldBy != null;
        boolean holdClear = holdToken == null && holdExpiresAt == null && heldBy == null;
        boolean bookingSet = bookedByName != null && bookedAt != null;
        boolean bookingClear = bookedByName == null && bookedAt == null;

        if (status == null) {
            return false;
        }
        return switch (status) {
            case AVAILABLE -> holdClear && bookingClear;
            case HELD -> holdSet && bookingClear;
            case BOOKED -> bookingSet && holdClear;
        };
    }
}
