package org.pokerroom.service.poker.analysis;

import org.pokerroom.model.poker.rules.HandRank;

/** A hand the player can still make; probability is the rule-of-2-and-4 estimate in [0, 0.99]. */
public record PotentialHand(HandRank rank, String name, int outs, double probability) {}
