package org.pokerroom.service.poker.engine;

public record SeatResult(boolean ok, int seat, RejectReason reason) {

    public static SeatResult seated(int seat) {
        return new SeatResult(true, seat, null);
    }

    public static SeatResult rejected(int seat, RejectReason reason) {
        return new SeatResult(false, seat, reason);
    }
}
