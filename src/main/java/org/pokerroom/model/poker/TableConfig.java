package org.pokerroom.model.poker;

import lombok.Builder;

/**
 * Immutable table settings, fixed for the lifetime of a table.
 * {@code timeLimitSeconds} is the per-action clock used by the dealer.
 */
@Builder(toBuilder = true)
public record TableConfig(
        Long id,
        String name,
        int tableSize,
        long smallBlind,
        long bigBlind,
        long minBuyIn,
        long maxBuyIn,
        int timeLimitSeconds,
        BettingStructure bettingStructure,
        PokerVariant variant
) {
    public TableConfig {
        if (tableSize < 2 || tableSize > 9) throw new IllegalArgumentException("Taille de table invalide: " + tableSize);
        if (smallBlind <= 0 || bigBlind < smallBlind) throw new IllegalArgumentException("Blindes invalides");
        if (minBuyIn <= 0 || maxBuyIn < minBuyIn) throw new IllegalArgumentException("Buy-in invalide");
        if (timeLimitSeconds <= 0) timeLimitSeconds = 30;
        if (bettingStructure == null) bettingStructure = BettingStructure.NO_LIMIT;
        if (variant == null) variant = PokerVariant.HOLDEM;
    }

    public String stakes() {
        return smallBlind + "/" + bigBlind;
    }
}
