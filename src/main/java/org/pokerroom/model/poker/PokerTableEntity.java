package org.pokerroom.model.poker;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "poker_table")
@Data
public class PokerTableEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "table_size", nullable = false)
    private int tableSize;

    @Column(name = "small_blind", nullable = false)
    private long smallBlind;

    @Column(name = "big_blind", nullable = false)
    private long bigBlind;

    @Column(name = "min_buy_in", nullable = false)
    private long minBuyIn;

    @Column(name = "max_buy_in", nullable = false)
    private long maxBuyIn;

    @Column(name = "time_limit_seconds")
    private int timeLimitSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "betting_structure", length = 16)
    private BettingStructure bettingStructure;

    @Enumerated(EnumType.STRING)
    @Column(name = "variant", length = 16)
    private PokerVariant variant;

    @Column(name = "created_at")
    private Instant createdAt;

    public TableConfig toConfig() {
        return TableConfig.builder()
                .id(id).name(name).tableSize(tableSize)
                .smallBlind(smallBlind).bigBlind(bigBlind)
                .minBuyIn(minBuyIn).maxBuyIn(maxBuyIn)
                .timeLimitSeconds(timeLimitSeconds)
                .bettingStructure(bettingStructure).variant(variant)
                .build();
    }

    public static PokerTableEntity from(TableConfig cfg) {
        PokerTableEntity e = new PokerTableEntity();
        e.setName(cfg.name());
        e.setTableSize(cfg.tableSize());
        e.setSmallBlind(cfg.smallBlind());
        e.setBigBlind(cfg.bigBlind());
        e.setMinBuyIn(cfg.minBuyIn());
        e.setMaxBuyIn(cfg.maxBuyIn());
        e.setTimeLimitSeconds(cfg.timeLimitSeconds());
        e.setBettingStructure(cfg.bettingStructure());
        e.setVariant(cfg.variant());
        e.setCreatedAt(Instant.now());
        return e;
    }
}
