package org.pokerroom.service.poker.dealer;

import lombok.RequiredArgsConstructor;
import org.pokerroom.dto.poker.TableSnapshot;
import org.pokerroom.model.poker.TableSnapshotEntity;
import org.pokerroom.repo.TableSnapshotRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class JpaSnapshotSink implements SnapshotSink {
    private final TableSnapshotRepository repo;

    @Override
    @Transactional
    public void write(TableSnapshot s) {
        TableSnapshotEntity e = new TableSnapshotEntity();
        e.setTableId(s.tableId());
        e.setHandNumber(s.handNumber());
        e.setStreet(s.street());
        e.setPotTotal(s.potTotal());
        e.setCurrentBet(s.currentBet());
        e.setCommunityCards(String.join(" ", s.communityCards()));
        e.setDealerSeat(s.dealerSeat());
        e.setActiveSeat(s.activeSeat());
        e.setTakenAt(s.takenAt());
        repo.save(e);
    }
}
