package org.pokerroom.service.poker.analysis;

import org.pokerroom.model.poker.rules.HandRank;

import java.util.List;

public record HandStrength(
        HandRank rank,
        String name,
        String description,
        int strength,
        int outs,
        List<PotentialHand> potentialHands
) {
    public HandStrength {
        potentialHands = List.copyOf(potentialHands);
    }
}
