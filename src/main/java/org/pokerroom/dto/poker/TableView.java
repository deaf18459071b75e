package org.pokerroom.dto.poker;

import org.pokerroom.model.poker.*;

import java.util.List;
import java.util.Objects;

/**
 * Detached copy of a table's state. Nothing here aliases engine-owned
 * objects, so callers may hold or serialize it freely.
 */
public record TableView(
        Long tableId,
        String name,
        String stakes,
        PokerVariant variant,
        long handNumber,
        Street street,
        List<SeatView> seats,
        List<Card> communityCards,
        List<PotView> pots,
        long potTotal,
        long currentBet,
        long minRaise,
        Integer activePlayerSeat,
        int dealerSeat,
        int smallBlindSeat,
        int bigBlindSeat,
        List<HandHistoryEntry> handHistory
) {
    /** Every hole card visible. For the table authority only. */
    public static TableView full(PokerTable t) {
        return of(t, null, true);
    }

    /** The viewer sees their own hole cards, everyone's at showdown. */
    public static TableView forViewer(PokerTable t, String viewerId) {
        return of(t, viewerId, false);
    }

    private static TableView of(PokerTable t, String viewerId, boolean revealAll) {
        boolean showdown = t.getStreet() == Street.SHOWDOWN;
        List<SeatView> seats = t.getSeats().values().stream()
                .map(s -> SeatView.of(s,
                        revealAll || showdown || s.occupant().map(p -> Objects.equals(p.getId(), viewerId)).orElse(false),
                        viewerId))
                .toList();
        return new TableView(
                t.getId(),
                t.getConfig().name(),
                t.getConfig().stakes(),
                t.getConfig().variant(),
                t.getHandNumber(),
                t.getStreet(),
                seats,
                List.copyOf(t.getCommunityCards()),
                t.getPots().stream().map(PotView::of).toList(),
                t.potTotal(),
                t.getCurrentBet(),
                t.getMinRaise(),
                t.getActivePlayerSeat(),
                t.getDealerSeat(),
                t.getSmallBlindSeat(),
                t.getBigBlindSeat(),
                List.copyOf(t.getHandHistory())
        );
    }

    /** Hole cards stripped from every seat unless the hand is at showdown. */
    public TableView sanitized() {
        if (street == Street.SHOWDOWN) return this;
        return new TableView(tableId, name, stakes, variant, handNumber, street,
                seats.stream().map(SeatView::withoutHoleCards).toList(),
                communityCards, pots, potTotal, currentBet, minRaise, activePlayerSeat,
                dealerSeat, smallBlindSeat, bigBlindSeat, handHistory);
    }

    public long chipsInPlay() {
        long stacks = seats.stream().mapToLong(SeatView::chipStack).sum();
        long bets = seats.stream().mapToLong(SeatView::streetBet).sum();
        return stacks + bets + potTotal;
    }
}
