package org.pokerroom.model.poker;

import lombok.Getter;

import java.util.Optional;

/** One slot of the table. Either EMPTY or OCCUPIED by exactly one player. */
@Getter
public class Seat {
    private final int number;
    private SeatStatus status = SeatStatus.EMPTY;
    private Player player;

    public Seat(int number) {
        this.number = number;
    }

    public boolean isEmpty() {
        return status == SeatStatus.EMPTY;
    }

    public Optional<Player> occupant() {
        return Optional.ofNullable(player);
    }

    public void sit(Player p) {
        if (!isEmpty()) throw new IllegalStateException("Siège " + number + " occupé");
        p.setSeatNumber(number);
        this.player = p;
        this.status = SeatStatus.OCCUPIED;
    }

    public Player clear() {
        Player p = player;
        this.player = null;
        this.status = SeatStatus.EMPTY;
        return p;
    }
}
