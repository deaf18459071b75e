package org.pokerroom.model.poker.rules;

import org.pokerroom.model.poker.Card;

import java.util.*;
import java.util.function.Function;

/**
 * Hand scoring for Hold'em and Omaha. All searches are exhaustive over the
 * allowed 5-card combinations, so results do not depend on input order.
 */
public final class HandEvaluator {
    private HandEvaluator(){}

    private static final Comparator<EvaluatedHand> HIGH = HandEvaluator::compareHands;
    private static final Comparator<EvaluatedHand> LOW = HandEvaluator::compareLowHands;

    /** Best 5-card hand out of 5 or more cards. */
    public static EvaluatedHand evaluateHand(List<Card> cards) {
        if (cards == null || cards.size() < 5) {
            throw new InvalidHandException("au moins 5 cartes requises, reçu " + (cards == null ? 0 : cards.size()));
        }
        EvaluatedHand best = null;
        for (List<Card> combo : combinations(cards, 5)) {
            EvaluatedHand h = evaluateFiveCardHand(combo);
            if (best == null || compareHands(h, best) > 0) best = h;
        }
        return best;
    }

    /** Omaha high: exactly two hole cards with exactly three board cards. */
    public static EvaluatedHand evaluateOmahaHand(List<Card> hole, List<Card> board) {
        if (hole == null || board == null || hole.size() < 2 || board.size() < 3) {
            throw new InvalidHandException("Omaha exige 2 cartes privatives et 3 cartes communes");
        }
        EvaluatedHand best = null;
        for (List<Card> h : combinations(hole, 2)) {
            for (List<Card> b : combinations(board, 3)) {
                List<Card> five = new ArrayList<>(h);
                five.addAll(b);
                EvaluatedHand e = evaluateFiveCardHand(five);
                if (best == null || compareHands(e, best) > 0) best = e;
            }
        }
        return best;
    }

    /**
     * Omaha 8-or-better low. Five distinct ranks, all eight or lower with the
     * ace counted as one. Straights and flushes are ignored.
     */
    public static Optional<EvaluatedHand> evaluateOmahaLowHand(List<Card> hole, List<Card> board) {
        if (hole == null || board == null || hole.size() < 2 || board.size() < 3) return Optional.empty();

        EvaluatedHand best = null;
        for (List<Card> h : combinations(hole, 2)) {
            for (List<Card> b : combinations(board, 3)) {
                List<Card> five = new ArrayList<>(h);
                five.addAll(b);
                Optional<EvaluatedHand> low = lowOf(five);
                if (low.isPresent() && (best == null || compareLowHands(low.get(), best) > 0)) best = low.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private static Optional<EvaluatedHand> lowOf(List<Card> five) {
        List<Card> sorted = new ArrayList<>(five);
        sorted.sort(Comparator.comparingInt((Card c) -> c.getRank().lowValue()).reversed());
        List<Integer> values = sorted.stream().map(c -> c.getRank().lowValue()).toList();
        if (new HashSet<>(values).size() != 5 || values.get(0) > 8) return Optional.empty();

        StringJoiner desc = new StringJoiner("-", "", " low");
        for (Card c : sorted) desc.add(String.valueOf(c.getRank().symbol()));
        return Optional.of(new EvaluatedHand(HandRank.HIGH_CARD, values, desc.toString(), sorted));
    }

    /** Scores exactly five cards. */
    public static EvaluatedHand evaluateFiveCardHand(List<Card> cards) {
        if (cards == null || cards.size() != 5) {
            throw new InvalidHandException("exactement 5 cartes requises");
        }
        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(Comparator.comparingInt(Card::value).reversed());

        boolean flush = sorted.stream().map(Card::getSuit).distinct().count() == 1;
        int straightHigh = straightHigh(sorted);
        if (straightHigh == 5) {
            // roue: l'as passe en dernier
            sorted.add(sorted.remove(0));
        }

        Map<Integer, Integer> counts = new HashMap<>();
        for (Card c : sorted) counts.merge(c.value(), 1, Integer::sum);
        List<Integer> groups = new ArrayList<>(counts.keySet());
        groups.sort((a, b) -> {
            int byCount = Integer.compare(counts.get(b), counts.get(a));
            return byCount != 0 ? byCount : Integer.compare(b, a);
        });
        int top = counts.get(groups.get(0));
        int second = groups.size() > 1 ? counts.get(groups.get(1)) : 0;

        if (flush && straightHigh == 14) {
            return new EvaluatedHand(HandRank.ROYAL_FLUSH, List.of(14, 13, 12, 11, 10), "Royal Flush", sorted);
        }
        if (flush && straightHigh > 0) {
            return new EvaluatedHand(HandRank.STRAIGHT_FLUSH, List.of(straightHigh),
                    "Straight Flush, " + name(straightHigh) + " high", sorted);
        }
        if (top == 4) {
            return new EvaluatedHand(HandRank.FOUR_OF_A_KIND, groups,
                    "Four of a Kind, " + plural(groups.get(0)), sorted);
        }
        if (top == 3 && second == 2) {
            return new EvaluatedHand(HandRank.FULL_HOUSE, groups,
                    "Full House, " + plural(groups.get(0)) + " full of " + plural(groups.get(1)), sorted);
        }
        if (flush) {
            return new EvaluatedHand(HandRank.FLUSH, values(sorted),
                    "Flush, " + name(sorted.get(0).value()) + " high", sorted);
        }
        if (straightHigh > 0) {
            return new EvaluatedHand(HandRank.STRAIGHT, List.of(straightHigh),
                    "Straight, " + name(straightHigh) + " high", sorted);
        }
        if (top == 3) {
            return new EvaluatedHand(HandRank.THREE_OF_A_KIND, groups,
                    "Three of a Kind, " + plural(groups.get(0)), sorted);
        }
        if (top == 2 && second == 2) {
            return new EvaluatedHand(HandRank.TWO_PAIR, groups,
                    "Two Pair, " + plural(groups.get(0)) + " and " + plural(groups.get(1)), sorted);
        }
        if (top == 2) {
            return new EvaluatedHand(HandRank.PAIR, groups, "Pair of " + plural(groups.get(0)), sorted);
        }
        return new EvaluatedHand(HandRank.HIGH_CARD, values(sorted), name(sorted.get(0).value()) + " high", sorted);
    }

    /** Positive if {@code a} wins, negative if {@code b} wins, 0 on an exact tie. */
    public static int compareHands(EvaluatedHand a, EvaluatedHand b) {
        if (a.rankValue() != b.rankValue()) return Integer.compare(a.rankValue(), b.rankValue());
        return compareKickers(a.kickers(), b.kickers());
    }

    /** Positive if {@code a} is the better (lower) low. */
    public static int compareLowHands(EvaluatedHand a, EvaluatedHand b) {
        return -compareKickers(a.kickers(), b.kickers());
    }

    private static int compareKickers(List<Integer> a, List<Integer> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(a.get(i), b.get(i));
            if (cmp != 0) return cmp;
        }
        return 0;
    }

    /** Every entry tied with the best high hand, in input order. */
    public static <T> List<T> determineWinners(List<T> entries, Function<T, EvaluatedHand> handOf) {
        return best(entries, handOf, HIGH);
    }

    /** Every entry tied with the best low hand, in input order. */
    public static <T> List<T> determineLowWinners(List<T> entries, Function<T, EvaluatedHand> handOf) {
        return best(entries, handOf, LOW);
    }

    private static <T> List<T> best(List<T> entries, Function<T, EvaluatedHand> handOf, Comparator<EvaluatedHand> cmp) {
        List<T> winners = new ArrayList<>();
        EvaluatedHand bestHand = null;
        for (T e : entries) {
            EvaluatedHand h = handOf.apply(e);
            int c = bestHand == null ? 1 : cmp.compare(h, bestHand);
            if (c > 0) {
                winners.clear();
                winners.add(e);
                bestHand = h;
            } else if (c == 0) {
                winners.add(e);
            }
        }
        return winners;
    }

    // ---------- helpers ----------

    private static int straightHigh(List<Card> sortedDesc) {
        List<Integer> v = values(sortedDesc).stream().distinct().toList();
        if (v.size() != 5) return 0;
        if (v.get(0) - v.get(4) == 4) return v.get(0);
        if (v.equals(List.of(14, 5, 4, 3, 2))) return 5;
        return 0;
    }

    private static List<Integer> values(List<Card> cards) {
        return cards.stream().map(Card::value).toList();
    }

    private static String name(int value) {
        return Card.Rank.labelOf(value);
    }

    private static String plural(int value) {
        String n = name(value);
        return n.endsWith("x") ? n + "es" : n + "s";
    }

    static <T> List<List<T>> combinations(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        combine(items, size, 0, new ArrayDeque<>(), out);
        return out;
    }

    private static <T> void combine(List<T> items, int size, int start, Deque<T> current, List<List<T>> out) {
        if (current.size() == size) {
            out.add(new ArrayList<>(current));
            return;
        }
        for (int i = start; i < items.size(); i++) {
            current.addLast(items.get(i));
            combine(items, size, i + 1, current, out);
            current.removeLast();
        }
    }
}
