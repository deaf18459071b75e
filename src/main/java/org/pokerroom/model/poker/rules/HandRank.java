package org.pokerroom.model.poker.rules;

public enum HandRank {
    HIGH_CARD(1, "High Card"),
    PAIR(2, "One Pair"),
    TWO_PAIR(3, "Two Pair"),
    THREE_OF_A_KIND(4, "Three of a Kind"),
    STRAIGHT(5, "Straight"),
    FLUSH(6, "Flush"),
    FULL_HOUSE(7, "Full House"),
    FOUR_OF_A_KIND(8, "Four of a Kind"),
    STRAIGHT_FLUSH(9, "Straight Flush"),
    ROYAL_FLUSH(10, "Royal Flush");

    private final int value;
    private final String label;

    HandRank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    public int value() { return value; }

    public String label() { return label; }
}
