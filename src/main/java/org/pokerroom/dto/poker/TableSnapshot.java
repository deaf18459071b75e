package org.pokerroom.dto.poker;

import java.time.Instant;
import java.util.List;

/** Point-in-time summary of a table, as written to the snapshot store. */
public record TableSnapshot(
        Long tableId,
        long handNumber,
        String street,
        long potTotal,
        long currentBet,
        List<String> communityCards,
        int dealerSeat,
        Integer activeSeat,
        Instant takenAt
) {
    public TableSnapshot {
        communityCards = List.copyOf(communityCards);
    }

    public static TableSnapshot of(TableView v) {
        return new TableSnapshot(v.tableId(), v.handNumber(), v.street().name(), v.potTotal(), v.currentBet(),
                v.communityCards().stream().map(c -> c.code()).toList(), v.dealerSeat(), v.activePlayerSeat(),
                Instant.now());
    }
}
