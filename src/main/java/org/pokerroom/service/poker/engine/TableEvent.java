package org.pokerroom.service.poker.engine;

import org.pokerroom.model.poker.ActionType;
import org.pokerroom.model.poker.Card;
import org.pokerroom.model.poker.Street;

import java.util.List;
import java.util.Set;

/**
 * Events emitted by {@link TableEngine}, one record per event name. They are
 * delivered synchronously, in emission order, on the mutating call's thread.
 */
public sealed interface TableEvent {
    Long tableId();
    long handNumber();

    /** Wire name of the event. */
    String name();

    record PlayerJoined(Long tableId, long handNumber, String playerId, int seat, long chipStack) implements TableEvent {
        public String name() { return "PLAYER_JOINED"; }
    }

    record PlayerLeft(Long tableId, long handNumber, String playerId, int seat, long chipStack) implements TableEvent {
        public String name() { return "PLAYER_LEFT"; }
    }

    record PlayerActed(Long tableId, long handNumber, String playerId, int seat,
                       ActionType action, long amount) implements TableEvent {
        public String name() { return "PLAYER_ACTION"; }
    }

    record PlayerTurn(Long tableId, long handNumber, String playerId, int seat, Street street) implements TableEvent {
        public String name() { return "PLAYER_TURN"; }
    }

    record StreetChanged(Long tableId, long handNumber, Street street, List<Card> communityCards) implements TableEvent {
        public StreetChanged {
            communityCards = List.copyOf(communityCards);
        }

        public String name() { return "STREET_CHANGED"; }
    }

    record HandComplete(Long tableId, long handNumber, List<Award> awards, List<PotResult> pots,
                        long totalAwarded) implements TableEvent {
        public HandComplete {
            awards = List.copyOf(awards);
            pots = List.copyOf(pots);
        }

        public String name() { return "HAND_COMPLETE"; }
    }

    /** Chips paid to one player from one pot. {@code low} marks the low half of a hi/lo pot. */
    record Award(String playerId, int seat, long amount, int potIndex, boolean low, String handDescription) {}

    record PotResult(int index, long amount, Set<String> eligiblePlayers, boolean mainPot) {
        public PotResult {
            eligiblePlayers = Set.copyOf(eligiblePlayers);
        }
    }
}
