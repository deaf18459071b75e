package org.pokerroom.service.poker.engine;

import lombok.extern.slf4j.Slf4j;
import org.pokerroom.dto.poker.TableView;
import org.pokerroom.model.poker.*;
import org.pokerroom.model.poker.rules.*;
import org.pokerroom.service.poker.engine.TableEvent.*;

import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;

/**
 * Betting state machine for one table.
 *
 * <p>Not thread-safe: callers serialize every mutating call (the dealer does
 * it under the table's stripe lock). Rejections come back as result values and
 * leave the state untouched. Events are pushed to the sink synchronously, in
 * the order the state changes happen.
 */
@Slf4j
public class TableEngine {
    private final PokerTable table;
    private final TableEventSink events;

    public TableEngine(TableConfig config, TableEventSink events) {
        this(config, new Deck(), events);
    }

    public TableEngine(TableConfig config, Deck deck, TableEventSink events) {
        this.table = new PokerTable(config, deck);
        this.events = events == null ? TableEventSink.NONE : events;
    }

    public TableConfig config() { return table.getConfig(); }

    public Long tableId() { return table.getId(); }

    public Street street() { return table.getStreet(); }

    public long handNumber() { return table.getHandNumber(); }

    public Integer activeSeat() { return table.getActivePlayerSeat(); }

    public Optional<Integer> seatOf(String playerId) {
        return table.findPlayer(playerId).map(Player::getSeatNumber);
    }

    public boolean handInProgress() {
        return table.getStreet() != Street.WAITING && table.getStreet() != Street.SHOWDOWN;
    }

    // ---------- seating ----------

    /** Seats the player at the first empty seat. */
    public SeatResult seatPlayer(Player player) {
        for (Seat s : table.getSeats().values()) {
            if (s.isEmpty()) return seatPlayer(player, s.getNumber());
        }
        return SeatResult.rejected(0, RejectReason.TABLE_FULL);
    }

    public SeatResult seatPlayer(Player player, int seat) {
        TableConfig cfg = table.getConfig();
        if (seat < 1 || seat > cfg.tableSize()) return SeatResult.rejected(seat, RejectReason.SEAT_OUT_OF_RANGE);
        if (table.findPlayer(player.getId()).isPresent()) return SeatResult.rejected(seat, RejectReason.ALREADY_SEATED);
        Seat target = table.getSeats().get(seat);
        if (!target.isEmpty()) return SeatResult.rejected(seat, RejectReason.SEAT_TAKEN);
        if (player.getChipStack() < cfg.minBuyIn()) return SeatResult.rejected(seat, RejectReason.BUY_IN_TOO_SMALL);
        if (player.getChipStack() > cfg.maxBuyIn()) return SeatResult.rejected(seat, RejectReason.BUY_IN_TOO_LARGE);

        player.resetForNextHand();
        player.setDealer(false);
        player.setSitOutNextHand(false);
        player.setStatus(PlayerStatus.WAITING);
        target.sit(player);

        record(HandHistoryEntry.Type.SYSTEM, player, null, player.getChipStack(), null, "joined seat " + seat);
        events.accept(new PlayerJoined(table.getId(), table.getHandNumber(), player.getId(), seat, player.getChipStack()));
        log.debug("table {} : {} assis au siège {} avec {}", table.getId(), player.getId(), seat, player.getChipStack());
        return SeatResult.seated(seat);
    }

    /**
     * Frees the seat. Refused (empty) while the occupant is still live in a
     * running hand, or folded with chips not yet collected this street; a
     * folded player may leave once their chips are in the pots.
     */
    public Optional<Player> removePlayer(int seat) {
        Seat s = table.getSeats().get(seat);
        if (s == null || s.isEmpty()) return Optional.empty();
        Player p = s.getPlayer();
        if (handInProgress() && (p.isInHand() || p.getStreetBet() > 0)) return Optional.empty();

        s.clear();
        p.setTurn(false);
        p.setDealer(false);
        record(HandHistoryEntry.Type.SYSTEM, p, null, p.getChipStack(), null, "left seat " + seat);
        events.accept(new PlayerLeft(table.getId(), table.getHandNumber(), p.getId(), seat, p.getChipStack()));
        return Optional.of(p);
    }

    /** Between hands the player sits out at once; mid-hand it takes effect when the hand ends. */
    public boolean sitOut(int seat) {
        Optional<Player> op = table.playerAt(seat);
        if (op.isEmpty()) return false;
        Player p = op.get();
        if (handInProgress() && (p.isInHand() || p.getStatus() == PlayerStatus.FOLDED)) {
            p.setSitOutNextHand(true);
        } else {
            p.setStatus(PlayerStatus.SITTING_OUT);
        }
        return true;
    }

    public boolean sitIn(int seat) {
        Optional<Player> op = table.playerAt(seat);
        if (op.isEmpty()) return false;
        Player p = op.get();
        p.setSitOutNextHand(false);
        if (p.getStatus() == PlayerStatus.SITTING_OUT || p.getStatus() == PlayerStatus.DISCONNECTED) {
            p.setStatus(PlayerStatus.WAITING);
        }
        return true;
    }

    /** Lost connection: dealt out of the next hands until {@link #sitIn(int)}. A live hand plays on under the clock. */
    public boolean markDisconnected(int seat) {
        Optional<Player> op = table.playerAt(seat);
        if (op.isEmpty()) return false;
        Player p = op.get();
        if (handInProgress() && (p.isInHand() || p.getStatus() == PlayerStatus.FOLDED)) {
            p.setSitOutNextHand(true);
        } else {
            p.setStatus(PlayerStatus.DISCONNECTED);
        }
        return true;
    }

    public boolean markReconnected(int seat) {
        Optional<Player> op = table.playerAt(seat);
        if (op.isEmpty() || op.get().getStatus() != PlayerStatus.DISCONNECTED) return false;
        op.get().setStatus(PlayerStatus.WAITING);
        return true;
    }

    /** Adds externally funded chips. Only between hands for that player, never above the max buy-in. */
    public SeatResult topUp(int seat, long amount) {
        Optional<Player> op = table.playerAt(seat);
        if (op.isEmpty()) return SeatResult.rejected(seat, RejectReason.SEAT_EMPTY);
        Player p = op.get();
        if (handInProgress() && (p.isInHand() || p.getStatus() == PlayerStatus.FOLDED)) {
            return SeatResult.rejected(seat, RejectReason.HAND_IN_PROGRESS);
        }
        if (amount <= 0) return SeatResult.rejected(seat, RejectReason.AMOUNT_TOO_SMALL);
        if (p.getChipStack() + amount > table.getConfig().maxBuyIn()) {
            return SeatResult.rejected(seat, RejectReason.BUY_IN_TOO_LARGE);
        }
        p.setChipStack(p.getChipStack() + amount);
        record(HandHistoryEntry.Type.SYSTEM, p, null, amount, null, "top-up");
        return SeatResult.seated(seat);
    }

    // ---------- hand lifecycle ----------

    public boolean canStartHand() {
        if (table.getStreet() != Street.WAITING) return false;
        return table.seatedPlayers().stream().filter(TableEngine::readyForHand).count() >= 2;
    }

    private static boolean readyForHand(Player p) {
        return p.getStatus() == PlayerStatus.WAITING && p.getChipStack() > 0;
    }

    /** @return false when {@link #canStartHand()} does not hold; nothing changes then */
    public boolean startNewHand() {
        if (!canStartHand()) return false;
        TableConfig cfg = table.getConfig();

        table.setHandNumber(table.getHandNumber() + 1);
        table.getCommunityCards().clear();
        table.getPots().clear();
        table.getHandHistory().clear();
        table.setCurrentBet(0);
        table.setMinRaise(cfg.bigBlind());
        table.setLastAggressorSeat(null);
        table.setActivePlayerSeat(null);

        for (Player p : table.seatedPlayers()) {
            p.resetForNextHand();
            p.setDealer(false);
            if (readyForHand(p)) p.setStatus(PlayerStatus.ACTIVE);
        }

        Deck deck = table.getDeck();
        deck.reset();
        deck.shuffle();

        int dealer = nextSeat(table.getDealerSeat(), Player::isInHand);
        table.setDealerSeat(dealer);
        table.playerAt(dealer).ifPresent(p -> p.setDealer(true));

        boolean headsUp = table.playersInHand().size() == 2;
        int sb = headsUp ? dealer : nextSeat(dealer, Player::isInHand);
        int bb = nextSeat(sb, Player::isInHand);
        table.setSmallBlindSeat(sb);
        table.setBigBlindSeat(bb);

        record(HandHistoryEntry.Type.SYSTEM, null, null, null, null,
                "hand " + table.getHandNumber() + " started, button on seat " + dealer);
        long sbPost = postBlind(sb, cfg.smallBlind(), "small blind");
        long bbPost = postBlind(bb, cfg.bigBlind(), "big blind");
        table.setCurrentBet(Math.max(sbPost, bbPost));

        dealHoleCards(sb, cfg.variant().holeCards());

        table.setStreet(Street.PREFLOP);
        record(HandHistoryEntry.Type.STREET_CHANGE, null, null, null, null, "preflop");
        events.accept(new StreetChanged(table.getId(), table.getHandNumber(), Street.PREFLOP, List.of()));
        log.debug("table {} : main {} (bouton {}, sb {}, bb {})", table.getId(), table.getHandNumber(), dealer, sb, bb);

        if (roundComplete()) {
            advanceStreet();
        } else {
            giveTurn(nextSeat(bb, Player::canAct));
        }
        return true;
    }

    private long postBlind(int seat, long amount, String label) {
        Player p = table.playerAt(seat).orElseThrow();
        long paid = Math.min(amount, p.getChipStack());
        commit(p, paid);
        if (p.getChipStack() == 0) p.setStatus(PlayerStatus.ALL_IN);
        record(HandHistoryEntry.Type.ACTION, p, null, paid, null, label);
        return paid;
    }

    // hole cards never go to the history: it is part of every view
    private void dealHoleCards(int firstSeat, int perPlayer) {
        List<Player> order = clockwiseFrom(firstSeat - 1, Player::isInHand);
        for (int round = 0; round < perPlayer; round++) {
            for (Player p : order) table.getDeck().deal().ifPresent(p.getHoleCards()::add);
        }
        record(HandHistoryEntry.Type.CARD_DEALT, null, null, null, null, perPlayer + " hole cards each");
    }

    // ---------- actions ----------

    /** Legal actions for the seat; empty unless it holds the turn. */
    public List<ValidAction> getValidActions(int seat) {
        return table.playerAt(seat).map(p -> BettingRules.validActions(table, p)).orElse(List.of());
    }

    /**
     * Applies an action for the seat holding the turn. BET amount is the chips
     * added, RAISE amount the raise-to total; CALL, CHECK, FOLD and ALL_IN
     * ignore it.
     */
    public ActionResult processAction(int seat, ActionType action, long amount) {
        if (!handInProgress()) return ActionResult.rejected(RejectReason.NO_HAND_IN_PROGRESS);
        if (!Objects.equals(table.getActivePlayerSeat(), seat)) return ActionResult.rejected(RejectReason.NOT_YOUR_TURN);
        Player p = table.playerAt(seat).orElse(null);
        if (p == null) return ActionResult.rejected(RejectReason.NOT_YOUR_TURN);

        ValidAction legal = BettingRules.validActions(table, p).stream()
                .filter(v -> v.action() == action)
                .findFirst().orElse(null);
        if (legal == null) return ActionResult.rejected(RejectReason.ILLEGAL_ACTION);

        long stack = p.getChipStack();
        long added;
        switch (action) {
            case FOLD, CHECK -> added = 0;
            case CALL -> added = BettingRules.owed(table, p);
            case ALL_IN -> added = stack;
            case BET -> {
                if (amount > stack) return ActionResult.rejected(RejectReason.INSUFFICIENT_CHIPS);
                if (amount < legal.minAmount()) return ActionResult.rejected(RejectReason.AMOUNT_TOO_SMALL);
                if (amount > legal.maxAmount()) return ActionResult.rejected(RejectReason.AMOUNT_TOO_LARGE);
                added = amount;
            }
            case RAISE -> {
                long extra = amount - p.getStreetBet();
                if (extra > stack) return ActionResult.rejected(RejectReason.INSUFFICIENT_CHIPS);
                if (amount < legal.minAmount()) return ActionResult.rejected(RejectReason.AMOUNT_TOO_SMALL);
                if (amount > legal.maxAmount()) return ActionResult.rejected(RejectReason.AMOUNT_TOO_LARGE);
                added = extra;
            }
            default -> {
                return ActionResult.rejected(RejectReason.ILLEGAL_ACTION);
            }
        }

        ActionType effective = action;
        if (action == ActionType.FOLD) {
            p.setStatus(PlayerStatus.FOLDED);
            for (Pot pot : table.getPots()) pot.removeEligible(p.getId());
        } else if (added > 0) {
            commit(p, added);
            if (p.getChipStack() == 0) {
                p.setStatus(PlayerStatus.ALL_IN);
                effective = ActionType.ALL_IN;
            }
            raiseIfAbove(p, seat);
        }
        p.setLastAction(effective);

        record(HandHistoryEntry.Type.ACTION, p, effective, added, null, null);
        events.accept(new PlayerActed(table.getId(), table.getHandNumber(), p.getId(), seat, effective, added));

        if (roundComplete()) {
            advanceStreet();
        } else {
            giveTurn(nextSeat(seat, Player::canAct));
        }
        return ActionResult.accepted(effective, added);
    }

    private void raiseIfAbove(Player p, int seat) {
        long total = p.getStreetBet();
        if (total <= table.getCurrentBet()) return;
        long increment = total - table.getCurrentBet();
        // une relance incomplète (all-in court) ne change pas la relance minimale
        if (increment >= table.getMinRaise()) {
            table.setMinRaise(increment);
            table.setLastAggressorSeat(seat);
        }
        table.setCurrentBet(total);
    }

    private void commit(Player p, long chips) {
        p.setChipStack(p.getChipStack() - chips);
        p.setStreetBet(p.getStreetBet() + chips);
        p.setTotalBetThisHand(p.getTotalBetThisHand() + chips);
    }

    /**
     * The betting round is over when at most one player has not folded, or when
     * every player still able to act has acted this street and matched the
     * current bet. A lone actor facing nobody who can respond is done as soon
     * as they owe nothing.
     */
    private boolean roundComplete() {
        List<Player> live = table.playersInHand();
        if (live.size() <= 1) return true;
        List<Player> actors = live.stream().filter(Player::canAct).toList();
        if (actors.isEmpty()) return true;
        if (actors.size() == 1) return actors.get(0).getStreetBet() >= table.getCurrentBet();
        return actors.stream().allMatch(p -> p.getLastAction() != null && p.getStreetBet() >= table.getCurrentBet());
    }

    private void giveTurn(int seat) {
        clearTurn();
        Player p = table.playerAt(seat).orElseThrow();
        p.setTurn(true);
        table.setActivePlayerSeat(seat);
        events.accept(new PlayerTurn(table.getId(), table.getHandNumber(), p.getId(), seat, table.getStreet()));
    }

    private void clearTurn() {
        for (Player p : table.seatedPlayers()) p.setTurn(false);
        table.setActivePlayerSeat(null);
    }

    // ---------- streets ----------

    private void advanceStreet() {
        PotRules.collectBets(table.seatedPlayers(), table.getPots());
        clearTurn();

        List<Player> live = table.playersInHand();
        if (live.size() <= 1) {
            awardUncontested(live);
            return;
        }
        if (table.getStreet() == Street.RIVER) {
            showdown();
            return;
        }

        boolean bettingOver = live.stream().filter(Player::canAct).count() < 2;
        dealNextStreet();
        table.setCurrentBet(0);
        table.setMinRaise(table.getConfig().bigBlind());
        table.setLastAggressorSeat(null);
        for (Player p : live) p.setLastAction(null);

        if (bettingOver) {
            advanceStreet();
        } else {
            giveTurn(nextSeat(table.getDealerSeat(), Player::canAct));
        }
    }

    private void dealNextStreet() {
        Street next = switch (table.getStreet()) {
            case PREFLOP -> Street.FLOP;
            case FLOP -> Street.TURN;
            case TURN -> Street.RIVER;
            default -> throw new IllegalStateException("pas de street après " + table.getStreet());
        };
        Deck deck = table.getDeck();
        deck.burn();
        List<Card> cards = deck.dealMultiple(next == Street.FLOP ? 3 : 1);
        table.getCommunityCards().addAll(cards);
        table.setStreet(next);

        record(HandHistoryEntry.Type.CARD_DEALT, null, null, null, cards, next.name().toLowerCase());
        record(HandHistoryEntry.Type.STREET_CHANGE, null, null, null, null, next.name().toLowerCase());
        events.accept(new StreetChanged(table.getId(), table.getHandNumber(), next, table.getCommunityCards()));
    }

    // ---------- settlement ----------

    private void awardUncontested(List<Player> live) {
        List<PotResult> results = potResults();
        List<Award> awards = new ArrayList<>();
        long total = 0;
        if (!live.isEmpty()) {
            Player winner = live.get(0);
            for (int i = 0; i < table.getPots().size(); i++) {
                long amount = table.getPots().get(i).getAmount();
                if (amount == 0) continue;
                winner.setChipStack(winner.getChipStack() + amount);
                awards.add(new Award(winner.getId(), winner.getSeatNumber(), amount, i, false, null));
                record(HandHistoryEntry.Type.WINNER, winner, null, amount, null, "wins uncontested");
                total += amount;
            }
        }
        table.getPots().clear();
        finish(awards, results, total);
    }

    private void showdown() {
        table.setStreet(Street.SHOWDOWN);
        record(HandHistoryEntry.Type.STREET_CHANGE, null, null, null, null, "showdown");

        PokerVariant variant = table.getConfig().variant();
        List<Card> board = table.getCommunityCards();
        List<Player> order = clockwiseFrom(table.getDealerSeat(), Player::isInHand);

        Map<String, EvaluatedHand> high = new HashMap<>();
        Map<String, EvaluatedHand> low = new HashMap<>();
        for (Player p : order) {
            high.put(p.getId(), evaluateHigh(p, board));
            if (variant == PokerVariant.OMAHA_HI_LO) {
                HandEvaluator.evaluateOmahaLowHand(p.getHoleCards(), board).ifPresent(h -> low.put(p.getId(), h));
            }
        }

        List<PotResult> results = potResults();
        List<Award> awards = new ArrayList<>();
        long total = 0;
        for (int i = 0; i < table.getPots().size(); i++) {
            Pot pot = table.getPots().get(i);
            long amount = pot.getAmount();
            if (amount == 0) continue;

            List<Player> contenders = order.stream().filter(p -> pot.eligible().contains(p.getId())).toList();
            if (contenders.isEmpty()) contenders = order;
            List<Player> lowContenders = contenders.stream().filter(p -> low.containsKey(p.getId())).toList();

            if (!lowContenders.isEmpty()) {
                long lowHalf = amount / 2;
                pay(amount - lowHalf, HandEvaluator.determineWinners(contenders, p -> high.get(p.getId())), high, i, false, awards);
                pay(lowHalf, HandEvaluator.determineLowWinners(lowContenders, p -> low.get(p.getId())), low, i, true, awards);
            } else {
                pay(amount, HandEvaluator.determineWinners(contenders, p -> high.get(p.getId())), high, i, false, awards);
            }
            total += amount;
        }
        table.getPots().clear();
        finish(awards, results, total);
    }

    private EvaluatedHand evaluateHigh(Player p, List<Card> board) {
        if (table.getConfig().variant().isOmaha()) {
            return HandEvaluator.evaluateOmahaHand(p.getHoleCards(), board);
        }
        List<Card> all = new ArrayList<>(p.getHoleCards());
        all.addAll(board);
        return HandEvaluator.evaluateHand(all);
    }

    private void pay(long amount, List<Player> winners, Map<String, EvaluatedHand> hands,
                     int potIndex, boolean lowHalf, List<Award> awards) {
        long[] shares = PotRules.split(amount, winners.size());
        for (int w = 0; w < winners.size(); w++) {
            Player p = winners.get(w);
            EvaluatedHand hand = hands.get(p.getId());
            p.setChipStack(p.getChipStack() + shares[w]);
            awards.add(new Award(p.getId(), p.getSeatNumber(), shares[w], potIndex, lowHalf, hand.description()));
            record(HandHistoryEntry.Type.WINNER, p, null, shares[w], hand.cards(), hand.description());
        }
    }

    private List<PotResult> potResults() {
        List<PotResult> out = new ArrayList<>();
        List<Pot> pots = table.getPots();
        for (int i = 0; i < pots.size(); i++) {
            Pot pot = pots.get(i);
            out.add(new PotResult(i, pot.getAmount(), pot.eligible(), pot.isMainPot()));
        }
        return out;
    }

    private void finish(List<Award> awards, List<PotResult> pots, long total) {
        events.accept(new HandComplete(table.getId(), table.getHandNumber(), awards, pots, total));
        log.info("table {} : main {} terminée, {} distribués", table.getId(), table.getHandNumber(), total);
        endHand();
    }

    private void endHand() {
        for (Player p : table.seatedPlayers()) {
            p.resetForNextHand();
            if (p.isSitOutNextHand()) {
                p.setStatus(PlayerStatus.SITTING_OUT);
                p.setSitOutNextHand(false);
            } else if (p.isInHand() || p.getStatus() == PlayerStatus.FOLDED) {
                p.setStatus(PlayerStatus.WAITING);
            }
        }
        table.setStreet(Street.WAITING);
        table.getCommunityCards().clear();
        table.getPots().clear();
        table.setCurrentBet(0);
        table.setMinRaise(table.getConfig().bigBlind());
        table.setActivePlayerSeat(null);
        table.setLastAggressorSeat(null);
    }

    // ---------- views ----------

    /** Full state, every hole card included. */
    public TableView getState() {
        return TableView.full(table);
    }

    /** Only the viewer's own hole cards, or everyone's at showdown. */
    public TableView getPlayerState(String viewerId) {
        return TableView.forViewer(table, viewerId);
    }

    // ---------- helpers ----------

    /** First occupied seat strictly after {@code from}, wrapping; may return {@code from} itself last. */
    private int nextSeat(int from, Predicate<Player> filter) {
        int n = table.getConfig().tableSize();
        for (int k = 1; k <= n; k++) {
            int s = Math.floorMod(from - 1 + k, n) + 1;
            Optional<Player> p = table.playerAt(s);
            if (p.isPresent() && filter.test(p.get())) return s;
        }
        throw new IllegalStateException("aucun siège éligible sur la table " + table.getId());
    }

    private List<Player> clockwiseFrom(int from, Predicate<Player> filter) {
        int n = table.getConfig().tableSize();
        List<Player> out = new ArrayList<>();
        for (int k = 1; k <= n; k++) {
            int s = Math.floorMod(from - 1 + k, n) + 1;
            table.playerAt(s).filter(filter).ifPresent(out::add);
        }
        return out;
    }

    private void record(HandHistoryEntry.Type type, Player p, ActionType action, Long amount,
                        List<Card> cards, String message) {
        table.getHandHistory().add(new HandHistoryEntry(table.handId(), Instant.now(), type,
                p == null ? null : p.getId(), action, amount, cards, table.getStreet(), message));
    }
}
