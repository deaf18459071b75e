package org.pokerroom.model.poker;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.*;

/**
 * Single 52-card deck. Draw pile and dealt pile always hold the 52 distinct
 * cards between them; a card leaves the draw pile exactly once per reset.
 */
public class Deck {
    private final Deque<Card> cards = new ArrayDeque<>();
    private final List<Card> dealt = new ArrayList<>();
    private final Random rnd;
    private final List<Card> preset;

    public Deck() {
        this(defaultRandom());
    }

    public Deck(Random rnd) {
        this(rnd, List.of());
    }

    private Deck(Random rnd, List<Card> preset) {
        this.rnd = rnd;
        this.preset = List.copyOf(preset);
        reset();
    }

    /**
     * Deck whose every shuffle leaves {@code firstOut} on top, dealt in that
     * order; the rest stays shuffled underneath. For replays and tests.
     */
    public static Deck stacked(List<Card> firstOut, Random rnd) {
        if (new HashSet<>(firstOut).size() != firstOut.size()) {
            throw new IllegalArgumentException("Cartes en double dans le paquet préparé");
        }
        return new Deck(rnd, firstOut);
    }

    public void reset() {
        cards.clear();
        dealt.clear();
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) cards.addLast(new Card(r, s));
        }
    }

    /** Fisher-Yates, in place. */
    public void shuffle() {
        Card[] tmp = cards.toArray(new Card[0]);
        for (int i = tmp.length - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            Card c = tmp[i];
            tmp[i] = tmp[j];
            tmp[j] = c;
        }
        cards.clear();
        cards.addAll(Arrays.asList(tmp));
        if (!preset.isEmpty()) {
            cards.removeAll(preset);
            for (int i = preset.size() - 1; i >= 0; i--) cards.addLast(preset.get(i));
        }
    }

    public Optional<Card> deal() {
        Card c = cards.pollLast();
        if (c == null) return Optional.empty();
        dealt.add(c);
        return Optional.of(c);
    }

    public List<Card> dealMultiple(int count) {
        List<Card> out = new ArrayList<>(Math.max(0, count));
        for (int i = 0; i < count; i++) {
            Optional<Card> c = deal();
            if (c.isEmpty()) break;
            out.add(c.get());
        }
        return out;
    }

    /** Dead card: dealt face down and never used. */
    public void burn() {
        deal();
    }

    public int remaining() { return cards.size(); }

    public boolean hasCards() { return !cards.isEmpty(); }

    public List<Card> dealt() { return Collections.unmodifiableList(dealt); }

    public List<Card> undealt() { return List.copyOf(cards); }

    // NativePRNGNonBlocking n'existe pas partout (Windows): SecureRandom par défaut sinon
    static SecureRandom defaultRandom() {
        try {
            return SecureRandom.getInstance("NativePRNGNonBlocking");
        } catch (NoSuchAlgorithmException e) {
            return new SecureRandom();
        }
    }
}
