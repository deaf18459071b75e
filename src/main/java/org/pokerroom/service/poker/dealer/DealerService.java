package org.pokerroom.service.poker.dealer;

import lombok.extern.slf4j.Slf4j;
import org.pokerroom.dto.poker.SeatView;
import org.pokerroom.dto.poker.TableSnapshot;
import org.pokerroom.dto.poker.TableSummary;
import org.pokerroom.dto.poker.TableView;
import org.pokerroom.model.poker.*;
import org.pokerroom.model.poker.rules.ValidAction;
import org.pokerroom.service.poker.access.TableBroadcaster;
import org.pokerroom.service.poker.engine.*;
import org.pokerroom.service.poker.util.Locks;
import org.pokerroom.service.poker.util.Timeouts;

import java.time.Instant;
import java.util.*;

/**
 * Runs one table: owns its engine, starts hands, keeps the turn clock and
 * relays state. Every entry point takes the table's stripe lock, timer
 * callbacks included, so the engine only ever sees one writer.
 */
@Slf4j
public class DealerService {
    static final String TURN_TIMER = "turn";
    static final String START_TIMER = "start";

    private final TableEngine engine;
    private final Long tableId;
    private final Timeouts timeouts;
    private final Locks locks;
    private final TableBroadcaster broadcaster;
    private final SnapshotSink snapshots;
    private final long settleDelayMs;

    private final Set<String> leavingAfterHand = new LinkedHashSet<>();
    private volatile Instant lastActiveAt = Instant.now();
    private long turnDeadlineEpochMs;
    private boolean settling;

    public DealerService(TableConfig config, Deck deck, Timeouts timeouts, Locks locks,
                         TableBroadcaster broadcaster, SnapshotSink snapshots, long settleDelayMs) {
        this.tableId = config.id();
        this.timeouts = timeouts;
        this.locks = locks;
        this.broadcaster = broadcaster;
        this.snapshots = snapshots;
        this.settleDelayMs = settleDelayMs;
        this.engine = new TableEngine(config, deck, this::onEvent);
    }

    public Long tableId() { return tableId; }

    public TableConfig config() { return engine.config(); }

    public Instant lastActiveAt() { return lastActiveAt; }

    // ---------- player commands ----------

    public SeatResult seat(String playerId, String displayName, Integer seat, long buyIn) {
        return locks.call(tableId, () -> {
            touch();
            Player p = new Player(playerId, displayName == null || displayName.isBlank() ? playerId : displayName, buyIn);
            SeatResult r = seat == null ? engine.seatPlayer(p) : engine.seatPlayer(p, seat);
            if (r.ok()) {
                leavingAfterHand.remove(playerId);
                afterChange();
            }
            return r;
        });
    }

    public ActionResult act(String playerId, ActionType action, long amount) {
        return locks.call(tableId, () -> {
            touch();
            Optional<Integer> seat = engine.seatOf(playerId);
            if (seat.isEmpty()) return ActionResult.rejected(RejectReason.NOT_YOUR_SEAT);

            boolean holdsTurn = Objects.equals(engine.activeSeat(), seat.get());
            long deadline = turnDeadlineEpochMs;
            if (holdsTurn) timeouts.cancel(tableId, TURN_TIMER);

            ActionResult r = engine.processAction(seat.get(), action, amount);
            if (r.accepted()) {
                afterChange();
            } else if (holdsTurn) {
                // même horloge: une action refusée ne rallonge pas le temps
                armTurnTimer(seat.get(), engine.handNumber(), engine.street(), deadline - System.currentTimeMillis());
            }
            return r;
        });
    }

    public LeaveOutcome leave(String playerId) {
        return locks.call(tableId, () -> {
            touch();
            Optional<Integer> seat = engine.seatOf(playerId);
            if (seat.isEmpty()) return LeaveOutcome.NOT_SEATED;
            if (engine.removePlayer(seat.get()).isPresent()) {
                afterChange();
                return LeaveOutcome.LEFT;
            }
            engine.sitOut(seat.get());
            leavingAfterHand.add(playerId);
            return LeaveOutcome.LEAVING_AFTER_HAND;
        });
    }

    public boolean sitOut(String playerId) {
        return locks.call(tableId, () -> engine.seatOf(playerId).map(s -> {
            engine.sitOut(s);
            afterChange();
            return true;
        }).orElse(false));
    }

    public boolean sitIn(String playerId) {
        return locks.call(tableId, () -> engine.seatOf(playerId).map(s -> {
            engine.sitIn(s);
            afterChange();
            return true;
        }).orElse(false));
    }

    public boolean disconnected(String playerId) {
        return locks.call(tableId, () -> engine.seatOf(playerId).map(s -> {
            engine.markDisconnected(s);
            afterChange();
            return true;
        }).orElse(false));
    }

    public boolean reconnected(String playerId) {
        return locks.call(tableId, () -> {
            boolean back = engine.seatOf(playerId).map(engine::markReconnected).orElse(false);
            if (back) afterChange();
            return back;
        });
    }

    public SeatResult topUp(String playerId, long amount) {
        return locks.call(tableId, () -> {
            Optional<Integer> seat = engine.seatOf(playerId);
            if (seat.isEmpty()) return SeatResult.rejected(0, RejectReason.NOT_YOUR_SEAT);
            SeatResult r = engine.topUp(seat.get(), amount);
            if (r.ok()) afterChange();
            return r;
        });
    }

    // ---------- views ----------

    /** What the table topic carries: no hole cards before showdown. */
    public TableView publicView() {
        return locks.call(tableId, () -> engine.getState().sanitized());
    }

    public TableView viewFor(String playerId) {
        return locks.call(tableId, () -> engine.getPlayerState(playerId));
    }

    public List<ValidAction> validActions(int seat) {
        return locks.call(tableId, () -> engine.getValidActions(seat));
    }

    public boolean isEmpty() {
        return locks.call(tableId, () -> engine.getState().seats().stream().allMatch(SeatView::empty));
    }

    public TableSummary summary() {
        return locks.call(tableId, () -> {
            TableConfig cfg = engine.config();
            int seated = (int) engine.getState().seats().stream().filter(s -> !s.empty()).count();
            return new TableSummary(tableId, cfg.name(), cfg.stakes(), cfg.variant().name(),
                    cfg.bettingStructure().name(), cfg.tableSize(), seated, engine.street().name(), engine.handNumber());
        });
    }

    public void stop() {
        timeouts.cancelAllOf(tableId);
    }

    // ---------- hand flow ----------

    void startIfReady() {
        locks.run(tableId, () -> {
            if (engine.canStartHand() && engine.startNewHand()) {
                touch();
                afterChange();
            }
        });
    }

    void onSettled() {
        locks.run(tableId, () -> {
            settling = false;
            startIfReady();
        });
    }

    void onTurnExpired(int seat, long hand, Street street) {
        locks.run(tableId, () -> {
            if (engine.handNumber() != hand || engine.street() != street || !Objects.equals(engine.activeSeat(), seat)) {
                return;
            }
            boolean canCheck = engine.getValidActions(seat).stream().anyMatch(v -> v.action() == ActionType.CHECK);
            ActionType auto = canCheck ? ActionType.CHECK : ActionType.FOLD;
            log.info("table {} : temps écoulé pour le siège {}, {} automatique", tableId, seat, auto);
            ActionResult r = engine.processAction(seat, auto, 0);
            if (r.accepted()) afterChange();
        });
    }

    private void onEvent(TableEvent e) {
        if (e instanceof TableEvent.PlayerTurn turn) {
            armTurnTimer(turn.seat(), turn.handNumber(), turn.street(), engine.config().timeLimitSeconds() * 1000L);
            relay(e.name(), e.handNumber(), Map.of(
                    "seat", turn.seat(),
                    "playerId", turn.playerId(),
                    "street", turn.street(),
                    "deadline", turnDeadlineEpochMs));
            return;
        }
        if (e instanceof TableEvent.HandComplete) {
            timeouts.cancel(tableId, TURN_TIMER);
            relay(e.name(), e.handNumber(), e);
            // showdown: les cartes sont encore visibles à cet instant
            publishState();
            settling = true;
            timeouts.schedule(tableId, START_TIMER, settleDelayMs, this::onSettled);
            return;
        }
        relay(e.name(), e.handNumber(), e);
    }

    private void armTurnTimer(int seat, long hand, Street street, long delayMs) {
        long delay = Math.max(0, delayMs);
        turnDeadlineEpochMs = System.currentTimeMillis() + delay;
        timeouts.schedule(tableId, TURN_TIMER, delay, () -> onTurnExpired(seat, hand, street));
    }

    private void afterChange() {
        if (engine.street() == Street.WAITING && !leavingAfterHand.isEmpty()) {
            for (Iterator<String> it = leavingAfterHand.iterator(); it.hasNext(); ) {
                String id = it.next();
                engine.seatOf(id).ifPresent(engine::removePlayer);
                it.remove();
            }
        }
        publishState();
        if (engine.street() == Street.WAITING && engine.canStartHand() && !settling) {
            startIfReady();
        }
    }

    private void publishState() {
        TableView full = engine.getState();
        safely("diffusion", () -> broadcaster.toTable(tableId, "TABLE_STATE", full.handNumber(), full.sanitized()));
        for (SeatView s : full.seats()) {
            if (s.empty()) continue;
            safely("vue privée", () -> broadcaster.toPlayer(s.playerId(), tableId, "PRIVATE_STATE",
                    full.handNumber(), engine.getPlayerState(s.playerId())));
        }
        safely("snapshot", () -> snapshots.write(TableSnapshot.of(full)));
    }

    private void relay(String type, long hand, Object payload) {
        safely("diffusion", () -> broadcaster.toTable(tableId, type, hand, payload));
    }

    private void safely(String what, Runnable r) {
        try {
            r.run();
        } catch (RuntimeException ex) {
            log.warn("table {} : échec {} ignoré: {}", tableId, what, ex.getMessage());
        }
    }

    private void touch() {
        lastActiveAt = Instant.now();
    }
}
