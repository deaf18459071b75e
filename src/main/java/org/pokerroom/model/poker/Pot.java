package org.pokerroom.model.poker;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

@Getter
public class Pot {
    private long amount;
    private final Set<String> eligiblePlayers = new LinkedHashSet<>();
    private final boolean mainPot;
    private boolean closed;

    public Pot(boolean mainPot) {
        this.mainPot = mainPot;
    }

    public void add(long chips, Collection<String> contributors) {
        if (closed) throw new IllegalStateException("Pot fermé");
        amount += chips;
        eligiblePlayers.addAll(contributors);
    }

    /** Freezes the amount and fixes the eligible set. */
    public void close(Collection<String> eligible) {
        eligiblePlayers.clear();
        eligiblePlayers.addAll(eligible);
        closed = true;
    }

    public void removeEligible(String playerId) {
        eligiblePlayers.remove(playerId);
    }

    public Set<String> eligible() {
        return Collections.unmodifiableSet(eligiblePlayers);
    }
}
