package org.pokerroom.dto.poker;

import org.pokerroom.model.poker.Pot;

import java.util.List;

public record PotView(long amount, List<String> eligiblePlayers, boolean mainPot, boolean closed) {

    public static PotView of(Pot p) {
        return new PotView(p.getAmount(), List.copyOf(p.eligible()), p.isMainPot(), p.isClosed());
    }
}
