package org.pokerroom.model.poker;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Player {
    private String id;
    private String displayName;
    private int seatNumber;
    private long chipStack;

    private final List<Card> holeCards = new ArrayList<>();
    private long streetBet = 0;        // engagé sur la street courante
    private long totalBetThisHand = 0;

    private PlayerStatus status = PlayerStatus.WAITING;
    private boolean turn = false;
    private boolean dealer = false;
    private ActionType lastAction;
    private boolean sitOutNextHand = false;

    public Player(String id, String displayName, long chipStack) {
        this.id = id;
        this.displayName = displayName;
        this.chipStack = chipStack;
    }

    public boolean isInHand() {
        return status == PlayerStatus.ACTIVE || status == PlayerStatus.ALL_IN;
    }

    public boolean canAct() {
        return status == PlayerStatus.ACTIVE;
    }

    public void resetForNextHand() {
        holeCards.clear();
        streetBet = 0;
        totalBetThisHand = 0;
        lastAction = null;
        turn = false;
    }
}
