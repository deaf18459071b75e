package org.pokerroom.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pokerroom.dto.poker.*;
import org.pokerroom.model.poker.Card;
import org.pokerroom.model.poker.TableConfig;
import org.pokerroom.model.poker.rules.ValidAction;
import org.pokerroom.repo.TableSnapshotRepository;
import org.pokerroom.service.poker.access.TableBroadcaster;
import org.pokerroom.service.poker.analysis.HandStrength;
import org.pokerroom.service.poker.analysis.HandStrengthAnalyzer;
import org.pokerroom.service.poker.dealer.DealerService;
import org.pokerroom.service.poker.dealer.LeaveOutcome;
import org.pokerroom.service.poker.engine.ActionResult;
import org.pokerroom.service.poker.engine.SeatResult;
import org.pokerroom.service.poker.registry.DealerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class PokerTableService {

    private final DealerRegistry registry;
    private final TableBroadcaster broadcaster;
    private final HandStrengthAnalyzer analyzer;
    private final TableSnapshotRepository snapshots;

    @Value("${poker.sweep.idle-ms:600000}")
    private long idleMs;

    public List<TableSummary> listTables() {
        return registry.all().stream()
                .map(DealerService::summary)
                .sorted(Comparator.comparing(TableSummary::getId))
                .toList();
    }

    public TableSummary createTable(CreateTableReq req) {
        long bb = req.getBigBlind();
        TableConfig cfg = TableConfig.builder()
                .name(req.getName())
                .tableSize(req.getTableSize() != null ? req.getTableSize() : 6)
                .smallBlind(req.getSmallBlind())
                .bigBlind(bb)
                .minBuyIn(req.getMinBuyIn() != null ? req.getMinBuyIn() : bb * 20)
                .maxBuyIn(req.getMaxBuyIn() != null ? req.getMaxBuyIn() : bb * 100)
                .timeLimitSeconds(req.getTimeLimitSeconds() != null ? req.getTimeLimitSeconds() : 30)
                .bettingStructure(req.getBettingStructure())
                .variant(req.getVariant())
                .build();
        DealerService d = registry.createAndPersist(cfg);
        log.info("table de poker {} créée ({} {})", d.tableId(), cfg.variant(), cfg.stakes());
        broadcaster.lobby(listTables());
        return d.summary();
    }

    public SeatResult seat(String playerId, SeatMsg msg) {
        return registry.get(msg.getTableId()).seat(playerId, msg.getDisplayName(), msg.getSeat(), msg.getBuyIn());
    }

    public ActionResult act(String playerId, ActionMsg msg) {
        return registry.get(msg.getTableId()).act(playerId, msg.getAction(), msg.getAmount());
    }

    public LeaveOutcome leave(String playerId, Long tableId) {
        return registry.get(tableId).leave(playerId);
    }

    public boolean sitOut(String playerId, Long tableId) {
        return registry.get(tableId).sitOut(playerId);
    }

    public boolean sitIn(String playerId, Long tableId) {
        return registry.get(tableId).sitIn(playerId);
    }

    public SeatResult topUp(String playerId, Long tableId, long amount) {
        return registry.get(tableId).topUp(playerId, amount);
    }

    public void markDisconnected(String playerId) {
        for (DealerService d : registry.all()) {
            if (d.disconnected(playerId)) log.debug("{} déconnecté de la table {}", playerId, d.tableId());
        }
    }

    public void markReconnected(String playerId) {
        for (DealerService d : registry.all()) d.reconnected(playerId);
    }

    public TableView view(Long tableId, String playerId) {
        DealerService d = registry.get(tableId);
        return playerId == null || playerId.isBlank() ? d.publicView() : d.viewFor(playerId);
    }

    public List<ValidAction> validActions(Long tableId, int seat) {
        return registry.get(tableId).validActions(seat);
    }

    /** Live read of the player's own hand. */
    public HandStrength strength(Long tableId, String playerId) {
        DealerService d = registry.get(tableId);
        TableView v = d.viewFor(playerId);
        List<Card> hole = v.seats().stream()
                .filter(SeatView::hero)
                .findFirst()
                .map(SeatView::holeCards)
                .orElse(null);
        if (hole == null || hole.isEmpty()) throw new IllegalStateException("Aucune main en cours pour " + playerId);
        return analyzer.analyze(hole, v.communityCards(), d.config().variant());
    }

    @Transactional
    public void deleteTable(Long tableId) {
        registry.get(tableId);
        registry.remove(tableId);
        snapshots.deleteByTableId(tableId);
        broadcaster.tableClosed(tableId);
        broadcaster.lobby(listTables());
    }

    @Scheduled(fixedRateString = "${poker.sweep.interval-ms:600000}")
    public void sweepIdleTables() {
        Instant now = Instant.now();
        List<Long> toRemove = new ArrayList<>();
        for (DealerService d : registry.all()) {
            if (d.isEmpty() && Duration.between(d.lastActiveAt(), now).toMillis() > idleMs) {
                toRemove.add(d.tableId());
            }
        }
        for (Long id : toRemove) {
            log.info("table {} inactive, fermeture", id);
            deleteTable(id);
        }
    }
}
