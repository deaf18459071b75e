package org.pokerroom.model.poker.rules;

import org.pokerroom.model.poker.*;

import java.util.ArrayList;
import java.util.List;

public final class BettingRules {
    private BettingRules(){}

    public static long owed(PokerTable t, Player p) {
        return Math.max(0, t.getCurrentBet() - p.getStreetBet());
    }

    /** Legal actions for the player holding the turn; empty for anyone else. */
    public static List<ValidAction> validActions(PokerTable t, Player p) {
        if (p == null || !p.isTurn() || p.getStatus() != PlayerStatus.ACTIVE) return List.of();

        List<ValidAction> out = new ArrayList<>();
        long toCall = owed(t, p);
        long stack = p.getChipStack();

        if (toCall > 0) out.add(ValidAction.of(ActionType.FOLD));
        if (toCall == 0) out.add(ValidAction.of(ActionType.CHECK));
        if (toCall > 0 && toCall < stack) out.add(new ValidAction(ActionType.CALL, toCall, toCall));

        if (t.getCurrentBet() == 0 && stack > 0) {
            long min = Math.min(betUnit(t), stack);
            long max = Math.min(maxBet(t), stack);
            out.add(new ValidAction(ActionType.BET, min, Math.max(min, max)));
        }

        if (t.getCurrentBet() > 0 && stack > toCall) {
            long ceiling = p.getStreetBet() + stack;
            long min = Math.min(t.getCurrentBet() + minRaiseIncrement(t), ceiling);
            long max = Math.min(maxRaiseTo(t, p), ceiling);
            out.add(new ValidAction(ActionType.RAISE, min, Math.max(min, max)));
        }

        if (stack > 0 && allInFits(t, p, toCall)) out.add(new ValidAction(ActionType.ALL_IN, stack, stack));
        return out;
    }

    /** Under pot and fixed limit, shoving is only legal when the stack is within the cap (or a short call). */
    private static boolean allInFits(PokerTable t, Player p, long toCall) {
        long stack = p.getChipStack();
        if (stack <= toCall) return true;
        if (t.getConfig().bettingStructure() == BettingStructure.NO_LIMIT) return true;
        if (t.getCurrentBet() == 0) return stack <= maxBet(t);
        return p.getStreetBet() + stack <= maxRaiseTo(t, p);
    }

    /** Small bet before the turn, big bet after it. Only fixed limit uses the big bet. */
    public static long betUnit(PokerTable t) {
        long bb = t.getConfig().bigBlind();
        if (t.getConfig().bettingStructure() == BettingStructure.FIXED_LIMIT
                && (t.getStreet() == Street.TURN || t.getStreet() == Street.RIVER)) {
            return bb * 2;
        }
        return bb;
    }

    private static long minRaiseIncrement(PokerTable t) {
        if (t.getConfig().bettingStructure() == BettingStructure.FIXED_LIMIT) return betUnit(t);
        return t.getMinRaise();
    }

    private static long maxBet(PokerTable t) {
        return switch (t.getConfig().bettingStructure()) {
            case NO_LIMIT -> Long.MAX_VALUE;
            case POT_LIMIT -> Math.max(betUnit(t), livePot(t));
            case FIXED_LIMIT -> betUnit(t);
        };
    }

    private static long maxRaiseTo(PokerTable t, Player p) {
        return switch (t.getConfig().bettingStructure()) {
            case NO_LIMIT -> Long.MAX_VALUE;
            // relance au pot: mise courante + pot après avoir suivi
            case POT_LIMIT -> t.getCurrentBet() + livePot(t) + owed(t, p);
            case FIXED_LIMIT -> t.getCurrentBet() + betUnit(t);
        };
    }

    /** Collected pots plus every chip committed on the current street. */
    public static long livePot(PokerTable t) {
        long street = t.seatedPlayers().stream().mapToLong(Player::getStreetBet).sum();
        return t.potTotal() + street;
    }
}
