package org.pokerroom.model.poker;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "poker_table_snapshot", indexes = @Index(name = "idx_snapshot_table", columnList = "table_id"))
@Data
public class TableSnapshotEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "hand_number")
    private long handNumber;

    @Column(name = "street", length = 16)
    private String street;

    @Column(name = "pot_total")
    private long potTotal;

    @Column(name = "current_bet")
    private long currentBet;

    // "Ah Kd 7c"
    @Column(name = "community_cards", length = 20)
    private String communityCards;

    @Column(name = "dealer_seat")
    private int dealerSeat;

    @Column(name = "active_seat")
    private Integer activeSeat;

    @Column(name = "taken_at")
    private Instant takenAt;
}
