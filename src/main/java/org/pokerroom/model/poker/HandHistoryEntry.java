package org.pokerroom.model.poker;

import java.time.Instant;
import java.util.List;

public record HandHistoryEntry(
        String handId,
        Instant timestamp,
        Type type,
        String playerId,
        ActionType action,
        Long amount,
        List<Card> cards,
        Street street,
        String message
) {
    public enum Type { ACTION, CARD_DEALT, STREET_CHANGE, WINNER, SYSTEM }

    public HandHistoryEntry {
        cards = cards == null ? List.of() : List.copyOf(cards);
    }
}
