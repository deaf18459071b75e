package org.pokerroom.model.poker;

public enum PokerVariant {
    HOLDEM(2), OMAHA(4), OMAHA_HI_LO(4);

    private final int holeCards;

    PokerVariant(int holeCards) { this.holeCards = holeCards; }

    public int holeCards() { return holeCards; }

    public boolean isOmaha() { return this != HOLDEM; }
}
