package org.pokerroom.model.poker.rules;

import org.pokerroom.model.poker.Card;

import java.util.List;

/**
 * Result of scoring five cards. {@code kickers} are in descending
 * significance; for low hands they are the ace-low values, highest first.
 */
public record EvaluatedHand(
        HandRank rank,
        int rankValue,
        List<Integer> kickers,
        String description,
        List<Card> cards
) {
    public EvaluatedHand {
        kickers = List.copyOf(kickers);
        cards = List.copyOf(cards);
    }

    public EvaluatedHand(HandRank rank, List<Integer> kickers, String description, List<Card> cards) {
        this(rank, rank.value(), kickers, description, cards);
    }
}
