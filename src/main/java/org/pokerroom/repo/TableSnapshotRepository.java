package org.pokerroom.repo;

import org.pokerroom.model.poker.TableSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface TableSnapshotRepository extends JpaRepository<TableSnapshotEntity, Long> {
    @Transactional
    void deleteByTableId(Long tableId);
}
