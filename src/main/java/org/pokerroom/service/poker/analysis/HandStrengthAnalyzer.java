package org.pokerroom.service.poker.analysis;

import org.pokerroom.model.poker.Card;
import org.pokerroom.model.poker.PokerVariant;
import org.pokerroom.model.poker.Street;
import org.pokerroom.model.poker.rules.EvaluatedHand;
import org.pokerroom.model.poker.rules.HandEvaluator;
import org.pokerroom.model.poker.rules.HandRank;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Rough live read of a hand: made category, draws, outs and a rule-of-2-and-4
 * equity. Display only; settlement always goes through {@link HandEvaluator}.
 */
@Service
public class HandStrengthAnalyzer {

    private static final Map<HandRank, Integer> BASE = new EnumMap<>(Map.of(
            HandRank.ROYAL_FLUSH, 100,
            HandRank.STRAIGHT_FLUSH, 95,
            HandRank.FOUR_OF_A_KIND, 90,
            HandRank.FULL_HOUSE, 82,
            HandRank.FLUSH, 75,
            HandRank.STRAIGHT, 68,
            HandRank.THREE_OF_A_KIND, 55,
            HandRank.TWO_PAIR, 45,
            HandRank.PAIR, 25,
            HandRank.HIGH_CARD, 10
    ));

    public HandStrength analyze(List<Card> hole, List<Card> board) {
        return analyze(hole, board, PokerVariant.HOLDEM);
    }

    /** Omaha reads only hands made of exactly two hole cards and three board cards. */
    public HandStrength analyze(List<Card> hole, List<Card> board, PokerVariant variant) {
        boolean omaha = variant != null && variant.isOmaha();
        List<Card> all = new ArrayList<>(hole);
        all.addAll(board);

        HandRank rank;
        String description;
        if (omaha && board.size() >= 3 && hole.size() >= 2) {
            EvaluatedHand h = HandEvaluator.evaluateOmahaHand(hole, board);
            rank = h.rank();
            description = h.description();
        } else if (!omaha && all.size() >= 5) {
            EvaluatedHand h = HandEvaluator.evaluateHand(all);
            rank = h.rank();
            description = h.description();
        } else {
            rank = preflopRank(all);
            description = preflopDescription(all, rank);
        }

        DrawAnalysis draws = omaha ? bestOmahaDraws(hole, board) : analyzeDraws(hole, board);
        int strength = BASE.get(rank);
        if (rank == HandRank.HIGH_CARD || rank == HandRank.PAIR) {
            if (draws.flushDraw()) strength += 10;
            if (draws.openEnded()) strength += 8;
            if (draws.gutshot()) strength += 4;
        }

        return new HandStrength(rank, rank.label(), description, Math.min(100, Math.max(0, strength)),
                draws.totalOuts(), potentialHands(draws, board.size()));
    }

    /**
     * Flush draw: exactly four of a suit, 9 outs. Straight draws look at
     * distinct values with the ace also counted as one: four in a row open at
     * both ends is open-ended (8 outs), a capped run or four within a span of
     * five is a gutshot (4 outs). A combined draw loses 2 shared outs.
     */
    public DrawAnalysis analyzeDraws(List<Card> hole, List<Card> board) {
        List<Card> all = new ArrayList<>(hole);
        all.addAll(board);
        if (all.size() < 4) return DrawAnalysis.NONE;

        Map<Card.Suit, Integer> suits = new EnumMap<>(Card.Suit.class);
        for (Card c : all) suits.merge(c.getSuit(), 1, Integer::sum);
        boolean flushDraw = suits.containsValue(4);
        int flushOuts = flushDraw ? 9 : 0;

        TreeSet<Integer> values = new TreeSet<>();
        for (Card c : all) {
            values.add(c.value());
            if (c.getRank() == Card.Rank.ACE) values.add(1);
        }
        List<Integer> v = new ArrayList<>(values);

        boolean openEnded = false;
        boolean gutshot = false;
        for (int i = 0; i + 3 < v.size() && !openEnded; i++) {
            if (v.get(i + 3) - v.get(i) == 3) {
                if (v.get(i) > 1 && v.get(i + 3) < 14) openEnded = true;
                else gutshot = true;
            }
        }
        if (!openEnded && !gutshot) {
            for (int i = 0; i + 3 < v.size(); i++) {
                if (v.get(i + 3) - v.get(i) == 4) {
                    gutshot = true;
                    break;
                }
            }
        }
        if (openEnded) gutshot = false;
        int straightOuts = openEnded ? 8 : gutshot ? 4 : 0;

        int total = flushOuts + straightOuts;
        if (flushDraw && straightOuts > 0) total -= 2;
        return new DrawAnalysis(flushDraw, openEnded, gutshot, flushOuts, straightOuts, Math.max(0, total));
    }

    private DrawAnalysis bestOmahaDraws(List<Card> hole, List<Card> board) {
        DrawAnalysis best = DrawAnalysis.NONE;
        for (int i = 0; i < hole.size(); i++) {
            for (int j = i + 1; j < hole.size(); j++) {
                DrawAnalysis d = analyzeDraws(List.of(hole.get(i), hole.get(j)), board);
                if (d.totalOuts() > best.totalOuts()) best = d;
            }
        }
        return best;
    }

    /** Outs ×4 on the flop, ×2 on the turn, nothing on the river; capped at 99. */
    public int estimateEquity(int outs, Street street) {
        int multiplier = switch (street) {
            case FLOP -> 4;
            case TURN -> 2;
            default -> 0;
        };
        return Math.min(99, outs * multiplier);
    }

    /** Strength minus 8 per opponent beyond the first, never below 5. */
    public int estimateVsOpponents(int strength, int opponents) {
        return Math.max(5, strength - (opponents - 1) * 8);
    }

    private List<PotentialHand> potentialHands(DrawAnalysis draws, int boardCards) {
        int toCome = 5 - boardCards;
        if (toCome <= 0 || boardCards < 3) return List.of();
        int multiplier = toCome == 2 ? 4 : 2;

        List<PotentialHand> out = new ArrayList<>();
        if (draws.flushDraw()) {
            out.add(new PotentialHand(HandRank.FLUSH, "Flush", draws.flushOuts(), probability(draws.flushOuts(), multiplier)));
        }
        if (draws.openEnded()) {
            out.add(new PotentialHand(HandRank.STRAIGHT, "Straight", draws.straightOuts(), probability(draws.straightOuts(), multiplier)));
        }
        if (draws.gutshot()) {
            out.add(new PotentialHand(HandRank.STRAIGHT, "Straight (Gutshot)", draws.straightOuts(), probability(draws.straightOuts(), multiplier)));
        }
        return out;
    }

    private static double probability(int outs, int multiplier) {
        return Math.min(0.99, outs * multiplier / 100.0);
    }

    private static HandRank preflopRank(List<Card> cards) {
        Set<Card.Rank> seen = EnumSet.noneOf(Card.Rank.class);
        for (Card c : cards) {
            if (!seen.add(c.getRank())) return HandRank.PAIR;
        }
        return HandRank.HIGH_CARD;
    }

    private static String preflopDescription(List<Card> cards, HandRank rank) {
        if (cards.isEmpty()) return rank.label();
        if (rank == HandRank.PAIR) {
            Set<Card.Rank> seen = EnumSet.noneOf(Card.Rank.class);
            for (Card c : cards) {
                if (!seen.add(c.getRank())) return "Pair of " + c.getRank().label() + (c.getRank() == Card.Rank.SIX ? "es" : "s");
            }
        }
        int high = cards.stream().mapToInt(Card::value).max().orElse(0);
        return Card.Rank.labelOf(high) + " high";
    }
}
