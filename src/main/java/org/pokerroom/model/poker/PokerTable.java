package org.pokerroom.model.poker;

import lombok.Data;

import java.util.*;

@Data
public class PokerTable {
    private final TableConfig config;

    private final Map<Integer, Seat> seats = new LinkedHashMap<>();
    private final Deck deck;

    private Street street = Street.WAITING;
    private final List<Card> communityCards = new ArrayList<>();
    private final List<Pot> pots = new ArrayList<>();

    private long currentBet = 0;
    private long minRaise;

    private Integer activePlayerSeat = null;
    private Integer lastAggressorSeat = null;
    private int dealerSeat = 0;
    private int smallBlindSeat = 0;
    private int bigBlindSeat = 0;

    private long handNumber = 0;
    private final List<HandHistoryEntry> handHistory = new ArrayList<>();

    public PokerTable(TableConfig config) {
        this(config, new Deck());
    }

    public PokerTable(TableConfig config, Deck deck) {
        this.config = config;
        this.deck = deck;
        this.minRaise = config.bigBlind();
        for (int i = 1; i <= config.tableSize(); i++) seats.put(i, new Seat(i));
    }

    public Long getId() { return config.id(); }

    public Optional<Player> playerAt(int seatNumber) {
        Seat s = seats.get(seatNumber);
        return s == null ? Optional.empty() : s.occupant();
    }

    /** Occupants in seat order. */
    public List<Player> seatedPlayers() {
        List<Player> out = new ArrayList<>();
        for (Seat s : seats.values()) s.occupant().ifPresent(out::add);
        return out;
    }

    public List<Player> playersInHand() {
        return seatedPlayers().stream().filter(Player::isInHand).toList();
    }

    public Optional<Player> findPlayer(String playerId) {
        return seatedPlayers().stream().filter(p -> Objects.equals(p.getId(), playerId)).findFirst();
    }

    public long potTotal() {
        return pots.stream().mapToLong(Pot::getAmount).sum();
    }

    public String handId() {
        return config.id() + "-" + handNumber;
    }
}
