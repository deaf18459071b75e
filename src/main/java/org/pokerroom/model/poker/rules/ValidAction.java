package org.pokerroom.model.poker.rules;

import org.pokerroom.model.poker.ActionType;

/**
 * A legal action with its amount bounds. CALL and ALL_IN bounds are the chips
 * added; BET is the chips added; RAISE is the raise-to total for the street.
 */
public record ValidAction(ActionType action, long minAmount, long maxAmount) {

    public static ValidAction of(ActionType action) {
        return new ValidAction(action, 0, 0);
    }

    public boolean accepts(long amount) {
        return amount >= minAmount && amount <= maxAmount;
    }
}
