package org.pokerroom.service.poker.engine;

public enum RejectReason {
    SEAT_OUT_OF_RANGE,
    SEAT_TAKEN,
    SEAT_EMPTY,
    ALREADY_SEATED,
    BUY_IN_TOO_SMALL,
    BUY_IN_TOO_LARGE,
    HAND_IN_PROGRESS,
    NO_HAND_IN_PROGRESS,
    NOT_YOUR_TURN,
    ILLEGAL_ACTION,
    AMOUNT_TOO_SMALL,
    AMOUNT_TOO_LARGE,
    INSUFFICIENT_CHIPS,
    NOT_ENOUGH_PLAYERS,
    NOT_YOUR_SEAT,
    TABLE_FULL
}
