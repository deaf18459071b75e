package org.pokerroom.model.poker.rules;

import org.pokerroom.model.poker.Player;
import org.pokerroom.model.poker.PlayerStatus;
import org.pokerroom.model.poker.Pot;

import java.util.*;

public final class PotRules {
    private PotRules(){}

    /**
     * Moves every street commitment into the pot ledger and zeroes the
     * per-player counters.
     *
     * <p>Contributions are processed by ascending tier. Each tier adds
     * {@code increment * contributorsAtOrAbove} to the open pot. A tier set by
     * an all-in player closes that pot, with eligibility fixed to the
     * non-folded contributors at or above the tier, so every distinct all-in
     * amount yields exactly one pot. Folded players' chips stay in the pots
     * but they are never eligible.
     *
     * @return chips moved into the pots
     */
    public static long collectBets(List<Player> players, List<Pot> pots) {
        List<Player> contributors = new ArrayList<>(players.stream().filter(p -> p.getStreetBet() > 0).toList());
        if (contributors.isEmpty()) return 0;
        contributors.sort(Comparator.comparingLong(Player::getStreetBet));

        long collected = 0;
        long previousTier = 0;
        int i = 0;
        while (i < contributors.size()) {
            long tier = contributors.get(i).getStreetBet();
            boolean allInAtTier = false;
            int j = i;
            while (j < contributors.size() && contributors.get(j).getStreetBet() == tier) {
                if (contributors.get(j).getStatus() == PlayerStatus.ALL_IN) allInAtTier = true;
                j++;
            }

            List<Player> atOrAbove = contributors.subList(i, contributors.size());
            List<String> eligible = atOrAbove.stream()
                    .filter(p -> p.getStatus() != PlayerStatus.FOLDED)
                    .map(Player::getId)
                    .toList();

            long chips = (tier - previousTier) * atOrAbove.size();
            Pot pot = openPot(pots);
            pot.add(chips, eligible);
            collected += chips;

            if (allInAtTier) pot.close(eligible);

            previousTier = tier;
            i = j;
        }

        for (Player p : players) p.setStreetBet(0);
        return collected;
    }

    private static Pot openPot(List<Pot> pots) {
        if (!pots.isEmpty()) {
            Pot last = pots.get(pots.size() - 1);
            if (!last.isClosed()) return last;
        }
        Pot fresh = new Pot(pots.isEmpty());
        pots.add(fresh);
        return fresh;
    }

    /**
     * Splits {@code amount} between {@code winners}; the remainder goes to the
     * first winner. Returned shares follow the winners' order.
     */
    public static long[] split(long amount, int winners) {
        long[] shares = new long[winners];
        if (winners == 0) return shares;
        long each = amount / winners;
        Arrays.fill(shares, each);
        shares[0] += amount - each * winners;
        return shares;
    }
}
