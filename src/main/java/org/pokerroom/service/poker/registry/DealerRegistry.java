package org.pokerroom.service.poker.registry;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pokerroom.model.poker.Deck;
import org.pokerroom.model.poker.PokerTableEntity;
import org.pokerroom.model.poker.TableConfig;
import org.pokerroom.repo.PokerTableRepository;
import org.pokerroom.service.poker.access.TableBroadcaster;
import org.pokerroom.service.poker.dealer.DealerService;
import org.pokerroom.service.poker.dealer.SnapshotSink;
import org.pokerroom.service.poker.util.Locks;
import org.pokerroom.service.poker.util.Timeouts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** One {@link DealerService} per table id. Table definitions survive restarts, table state does not. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DealerRegistry {
    private final PokerTableRepository repo;
    private final Timeouts timeouts;
    private final Locks locks;
    private final TableBroadcaster broadcaster;
    private final SnapshotSink snapshots;
    private final Map<Long, DealerService> dealers = new ConcurrentHashMap<>();

    @Value("${poker.dealer.settle-delay-ms:3000}")
    private long settleDelayMs;

    @PostConstruct
    public void loadFromDb() {
        for (PokerTableEntity e : repo.findAll()) {
            try {
                put(newDealer(e.toConfig()));
            } catch (IllegalArgumentException ex) {
                log.warn("table {} ignorée au chargement: {}", e.getId(), ex.getMessage());
            }
        }
        log.info("{} table(s) de poker chargée(s)", dealers.size());
    }

    public Collection<DealerService> all() { return dealers.values(); }

    public DealerService get(Long id) {
        DealerService d = id == null ? null : dealers.get(id);
        if (d == null) throw new IllegalArgumentException("Table inconnue: " + id);
        return d;
    }

    public DealerService createAndPersist(TableConfig cfg) {
        PokerTableEntity saved = repo.save(PokerTableEntity.from(cfg));
        DealerService d = newDealer(cfg.toBuilder().id(saved.getId()).build());
        put(d);
        return d;
    }

    public void remove(Long id) {
        DealerService d = dealers.remove(id);
        if (d != null) d.stop();
        try {
            repo.deleteById(id);
        } catch (DataAccessException ex) {
            log.warn("suppression de la table {} en base impossible: {}", id, ex.getMessage());
        }
    }

    private void put(DealerService d) { dealers.put(d.tableId(), d); }

    private DealerService newDealer(TableConfig cfg) {
        return new DealerService(cfg, new Deck(), timeouts, locks, broadcaster, snapshots, settleDelayMs);
    }
}
