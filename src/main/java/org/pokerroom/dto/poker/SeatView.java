package org.pokerroom.dto.poker;

import org.pokerroom.model.poker.ActionType;
import org.pokerroom.model.poker.Card;
import org.pokerroom.model.poker.Player;
import org.pokerroom.model.poker.PlayerStatus;
import org.pokerroom.model.poker.Seat;

import java.util.List;

/** Read-only copy of one seat. {@code holeCards} is null when hidden from the viewer. */
public record SeatView(
        int seat,
        boolean empty,
        String playerId,
        String displayName,
        long chipStack,
        long streetBet,
        long totalBetThisHand,
        PlayerStatus status,
        boolean turn,
        boolean dealer,
        ActionType lastAction,
        List<Card> holeCards,
        boolean hero
) {
    public static SeatView of(Seat s, boolean revealCards, String viewerId) {
        if (s.isEmpty()) {
            return new SeatView(s.getNumber(), true, null, null, 0, 0, 0, null, false, false, null, null, false);
        }
        Player p = s.getPlayer();
        return new SeatView(s.getNumber(), false, p.getId(), p.getDisplayName(), p.getChipStack(),
                p.getStreetBet(), p.getTotalBetThisHand(), p.getStatus(), p.isTurn(), p.isDealer(),
                p.getLastAction(), revealCards ? List.copyOf(p.getHoleCards()) : null,
                p.getId() != null && p.getId().equals(viewerId));
    }

    public SeatView withoutHoleCards() {
        return new SeatView(seat, empty, playerId, displayName, chipStack, streetBet, totalBetThisHand,
                status, turn, dealer, lastAction, null, hero);
    }
}
