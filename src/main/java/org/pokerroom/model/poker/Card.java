package org.pokerroom.model.poker;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    /** 2..14, ace high. */
    public int value() {
        return rank.value();
    }

    /** Two-character notation, e.g. "Ah", "Td". */
    public String code() {
        return "" + rank.symbol() + suit.symbol();
    }

    public static Card of(String code) {
        if (code == null || code.length() != 2) {
            throw new IllegalArgumentException("Carte invalide: " + code);
        }
        return new Card(Rank.fromSymbol(code.charAt(0)), Suit.fromSymbol(code.charAt(1)));
    }

    @Override
    public String toString() { return code(); }

    public enum Suit {
        CLUBS('c'), DIAMONDS('d'), HEARTS('h'), SPADES('s');

        private final char symbol;

        Suit(char symbol) { this.symbol = symbol; }

        public char symbol() { return symbol; }

        public static Suit fromSymbol(char c) {
            char lower = Character.toLowerCase(c);
            for (Suit s : values()) if (s.symbol == lower) return s;
            throw new IllegalArgumentException("Couleur invalide: " + c);
        }
    }

    public enum Rank {
        TWO('2', "Two"), THREE('3', "Three"), FOUR('4', "Four"), FIVE('5', "Five"),
        SIX('6', "Six"), SEVEN('7', "Seven"), EIGHT('8', "Eight"), NINE('9', "Nine"),
        TEN('T', "Ten"), JACK('J', "Jack"), QUEEN('Q', "Queen"), KING('K', "King"), ACE('A', "Ace");

        private final char symbol;
        private final String label;

        Rank(char symbol, String label) {
            this.symbol = symbol;
            this.label = label;
        }

        public int value() { return ordinal() + 2; }

        /** Ace counts as 1 for low hands. */
        public int lowValue() { return this == ACE ? 1 : value(); }

        public char symbol() { return symbol; }

        public String label() { return label; }

        public static Rank fromSymbol(char c) {
            char upper = Character.toUpperCase(c);
            for (Rank r : values()) if (r.symbol == upper) return r;
            throw new IllegalArgumentException("Rang invalide: " + c);
        }

        public static String labelOf(int value) {
            if (value == 1) return ACE.label;
            return values()[value - 2].label;
        }
    }
}
