package com.planforge.core.attempt;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a reservation or the reason none was granted. Rejections are expected outcomes, not errors.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReservationResult {
    AttemptReservation reservation;
    RejectionReason rejectionReason;
    long attemptsUsed;
    int attemptCap;

    public static ReservationResult reserved(AttemptReservation reservation, int attemptCap) {
        return new ReservationResult(reservation, null, reservation.getAttemptNumber(), attemptCap);
    }

    public static ReservationResult rejected(RejectionReason reason, long attemptsUsed, int attemptCap) {
        return new ReservationResult(null, reason, attemptsUsed, attemptCap);
    }

    public boolean isReserved() {
        return reservation != null;
    }
}
