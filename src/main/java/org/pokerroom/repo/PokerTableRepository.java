package org.pokerroom.repo;

import org.pokerroom.model.poker.PokerTableEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PokerTableRepository extends JpaRepository<PokerTableEntity, Long> {
}
