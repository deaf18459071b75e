package org.pokerroom.service.poker.dealer;

public enum LeaveOutcome {
    LEFT,
    /** Still live in the running hand; the seat is freed once it ends. */
    LEAVING_AFTER_HAND,
    NOT_SEATED
}
