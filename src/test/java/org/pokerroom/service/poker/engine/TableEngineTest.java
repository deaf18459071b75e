package org.pokerroom.service.poker.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pokerroom.dto.poker.SeatView;
import org.pokerroom.dto.poker.TableView;
import org.pokerroom.model.poker.*;
import org.pokerroom.model.poker.rules.ValidAction;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class TableEngineTest {

    private final List<TableEvent> events = new ArrayList<>();

    @BeforeEach
    void setup() {
        events.clear();
    }

    private static TableConfig config(int size, PokerVariant variant) {
        return TableConfig.builder()
                .id(7L).name("test").tableSize(size)
                .smallBlind(5).bigBlind(10)
                .minBuyIn(1).maxBuyIn(10_000)
                .variant(variant)
                .build();
    }

    private TableEngine engine(int size) {
        return new TableEngine(config(size, PokerVariant.HOLDEM), new Deck(new Random(99)), events::add);
    }

    private TableEngine stacked(int size, PokerVariant variant, String... codes) {
        List<Card> top = Arrays.stream(codes).map(Card::of).toList();
        return new TableEngine(config(size, variant), Deck.stacked(top, new Random(1)), events::add);
    }

    private static void seat(TableEngine e, int seat, String id, long chips) {
        assertThat(e.seatPlayer(new Player(id, id, chips), seat).ok()).isTrue();
    }

    private static SeatView seatView(TableView v, int seat) {
        return v.seats().get(seat - 1);
    }

    private static long chips(TableEngine e) {
        return e.getState().chipsInPlay();
    }

    private <T extends TableEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    // ------------------------------------------------------------
    // SEATING
    // ------------------------------------------------------------
    @Test
    void seat_rejections() {
        TableEngine e = new TableEngine(TableConfig.builder()
                .id(1L).name("t").tableSize(2).smallBlind(5).bigBlind(10).minBuyIn(100).maxBuyIn(1000).build(),
                events::add);

        assertThat(e.seatPlayer(new Player("a", "a", 500), 0).reason()).isEqualTo(RejectReason.SEAT_OUT_OF_RANGE);
        assertThat(e.seatPlayer(new Player("a", "a", 500), 3).reason()).isEqualTo(RejectReason.SEAT_OUT_OF_RANGE);
        assertThat(e.seatPlayer(new Player("a", "a", 50), 1).reason()).isEqualTo(RejectReason.BUY_IN_TOO_SMALL);
        assertThat(e.seatPlayer(new Player("a", "a", 5000), 1).reason()).isEqualTo(RejectReason.BUY_IN_TOO_LARGE);

        assertThat(e.seatPlayer(new Player("a", "a", 500), 1).ok()).isTrue();
        assertThat(e.seatPlayer(new Player("b", "b", 500), 1).reason()).isEqualTo(RejectReason.SEAT_TAKEN);
        assertThat(e.seatPlayer(new Player("a", "a", 500), 2).reason()).isEqualTo(RejectReason.ALREADY_SEATED);
        assertThat(e.seatPlayer(new Player("b", "b", 500)).seat()).isEqualTo(2);
        assertThat(e.seatPlayer(new Player("c", "c", 500)).reason()).isEqualTo(RejectReason.TABLE_FULL);

        assertThat(eventsOf(TableEvent.PlayerJoined.class)).hasSize(2);
        assertThat(seatView(e.getState(), 1).status()).isEqualTo(PlayerStatus.WAITING);
    }

    @Test
    void canStartHand_needsTwoWaitingPlayersWithChips() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        assertThat(e.canStartHand()).isFalse();
        assertThat(e.startNewHand()).isFalse();

        seat(e, 4, "b", 1000);
        assertThat(e.canStartHand()).isTrue();

        e.sitOut(4);
        assertThat(e.canStartHand()).isFalse();
        e.sitIn(4);
        assertThat(e.canStartHand()).isTrue();
    }

    // ------------------------------------------------------------
    // HEADS-UP FLOW
    // ------------------------------------------------------------
    @Test
    void headsUp_callCheck_reachesFlopWithSinglePot() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);

        assertThat(e.startNewHand()).isTrue();
        TableView v = e.getState();
        assertThat(v.street()).isEqualTo(Street.PREFLOP);
        assertThat(v.dealerSeat()).isEqualTo(1);
        assertThat(v.smallBlindSeat()).isEqualTo(1);
        assertThat(v.bigBlindSeat()).isEqualTo(2);
        assertThat(seatView(v, 1).chipStack()).isEqualTo(995);
        assertThat(seatView(v, 2).chipStack()).isEqualTo(990);
        assertThat(seatView(v, 1).holeCards()).hasSize(2);
        assertThat(v.activePlayerSeat()).isEqualTo(1);

        ActionResult call = e.processAction(1, ActionType.CALL, 0);
        assertThat(call.accepted()).isTrue();
        assertThat(call.amount()).isEqualTo(5);
        assertThat(e.activeSeat()).isEqualTo(2);

        assertThat(e.processAction(2, ActionType.CHECK, 0).accepted()).isTrue();

        v = e.getState();
        assertThat(v.street()).isEqualTo(Street.FLOP);
        assertThat(v.currentBet()).isZero();
        assertThat(v.minRaise()).isEqualTo(10);
        assertThat(v.pots()).hasSize(1);
        assertThat(v.pots().get(0).amount()).isEqualTo(20);
        assertThat(v.communityCards()).hasSize(3);
        assertThat(v.activePlayerSeat()).isEqualTo(2);
        assertThat(chips(e)).isEqualTo(2000);

        List<String> names = events.stream().map(TableEvent::name).toList();
        assertThat(names.lastIndexOf("PLAYER_ACTION")).isLessThan(names.lastIndexOf("STREET_CHANGED"));
    }

    @Test
    void smallBlindValidActions_preflop() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        e.startNewHand();

        List<ValidAction> actions = e.getValidActions(1);
        assertThat(actions).extracting(ValidAction::action)
                .containsExactly(ActionType.FOLD, ActionType.CALL, ActionType.RAISE, ActionType.ALL_IN);
        assertThat(actions.get(2).minAmount()).isEqualTo(20);
        assertThat(e.getValidActions(2)).isEmpty();
    }

    @Test
    void rejectedActions_leaveStateUnchanged() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        assertThat(e.processAction(1, ActionType.CHECK, 0).reason()).isEqualTo(RejectReason.NO_HAND_IN_PROGRESS);

        e.startNewHand();
        TableView before = e.getState();

        assertThat(e.processAction(2, ActionType.CHECK, 0).reason()).isEqualTo(RejectReason.NOT_YOUR_TURN);
        assertThat(e.processAction(1, ActionType.CHECK, 0).reason()).isEqualTo(RejectReason.ILLEGAL_ACTION);
        assertThat(e.processAction(1, ActionType.BET, 50).reason()).isEqualTo(RejectReason.ILLEGAL_ACTION);
        assertThat(e.processAction(1, ActionType.RAISE, 15).reason()).isEqualTo(RejectReason.AMOUNT_TOO_SMALL);
        assertThat(e.processAction(1, ActionType.RAISE, 5000).reason()).isEqualTo(RejectReason.INSUFFICIENT_CHIPS);

        TableView after = e.getState();
        assertThat(after.activePlayerSeat()).isEqualTo(before.activePlayerSeat());
        assertThat(after.currentBet()).isEqualTo(before.currentBet());
        assertThat(seatView(after, 1).chipStack()).isEqualTo(seatView(before, 1).chipStack());
        assertThat(after.handHistory()).hasSameSizeAs(before.handHistory());
    }

    @Test
    void raise_updatesMinRaiseAndReopensAction() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        e.startNewHand();

        assertThat(e.processAction(1, ActionType.RAISE, 40).accepted()).isTrue();
        TableView v = e.getState();
        assertThat(v.currentBet()).isEqualTo(40);
        assertThat(v.minRaise()).isEqualTo(30);
        assertThat(v.activePlayerSeat()).isEqualTo(2);

        ValidAction reraise = e.getValidActions(2).stream()
                .filter(a -> a.action() == ActionType.RAISE).findFirst().orElseThrow();
        assertThat(reraise.minAmount()).isEqualTo(70);

        assertThat(e.processAction(2, ActionType.CALL, 0).amount()).isEqualTo(30);
        assertThat(e.street()).isEqualTo(Street.FLOP);
        assertThat(e.getState().potTotal()).isEqualTo(80);
    }

    @Test
    void fold_endsHandEarly_andAwardsEverything() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        e.startNewHand();

        assertThat(e.processAction(1, ActionType.FOLD, 0).accepted()).isTrue();

        List<TableEvent.HandComplete> done = eventsOf(TableEvent.HandComplete.class);
        assertThat(done).hasSize(1);
        assertThat(done.get(0).totalAwarded()).isEqualTo(15);
        assertThat(done.get(0).awards()).singleElement()
                .satisfies(a -> {
                    assertThat(a.playerId()).isEqualTo("b");
                    assertThat(a.amount()).isEqualTo(15);
                });

        TableView v = e.getState();
        assertThat(v.street()).isEqualTo(Street.WAITING);
        assertThat(seatView(v, 1).chipStack()).isEqualTo(995);
        assertThat(seatView(v, 2).chipStack()).isEqualTo(1005);
        assertThat(seatView(v, 1).status()).isEqualTo(PlayerStatus.WAITING);
        assertThat(seatView(v, 1).holeCards()).isEmpty();
        assertThat(chips(e)).isEqualTo(2000);
    }

    @Test
    void buttonMoves_betweenHands() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 3, "b", 1000);
        seat(e, 5, "c", 1000);

        e.startNewHand();
        assertThat(e.getState().dealerSeat()).isEqualTo(1);
        assertThat(e.getState().smallBlindSeat()).isEqualTo(3);
        assertThat(e.getState().bigBlindSeat()).isEqualTo(5);
        assertThat(e.activeSeat()).isEqualTo(1);

        e.processAction(1, ActionType.FOLD, 0);
        e.processAction(3, ActionType.FOLD, 0);
        assertThat(e.street()).isEqualTo(Street.WAITING);

        e.startNewHand();
        assertThat(e.getState().dealerSeat()).isEqualTo(3);
        assertThat(e.handNumber()).isEqualTo(2);
    }

    // ------------------------------------------------------------
    // ALL-IN / SIDE POTS
    // ------------------------------------------------------------
    @Test
    void threeWayAllIn_buildsSidePots_andRunsOut() {
        TableEngine e = engine(6);
        seat(e, 1, "A", 100);
        seat(e, 2, "B", 300);
        seat(e, 3, "C", 500);
        e.startNewHand();

        assertThat(e.processAction(1, ActionType.ALL_IN, 0).amount()).isEqualTo(100);
        assertThat(e.processAction(2, ActionType.ALL_IN, 0).amount()).isEqualTo(295);
        assertThat(e.processAction(3, ActionType.ALL_IN, 0).amount()).isEqualTo(490);

        TableEvent.HandComplete done = eventsOf(TableEvent.HandComplete.class).get(0);
        assertThat(done.pots()).extracting(TableEvent.PotResult::amount).containsExactly(300L, 400L, 200L);
        assertThat(done.pots().get(0).eligiblePlayers()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(done.pots().get(1).eligiblePlayers()).containsExactlyInAnyOrder("B", "C");
        assertThat(done.pots().get(2).eligiblePlayers()).containsExactly("C");
        assertThat(done.totalAwarded()).isEqualTo(900);
        assertThat(done.awards()).filteredOn(a -> a.potIndex() == 2)
                .singleElement().satisfies(a -> assertThat(a.playerId()).isEqualTo("C"));

        assertThat(eventsOf(TableEvent.StreetChanged.class)).extracting(TableEvent.StreetChanged::street)
                .containsExactly(Street.PREFLOP, Street.FLOP, Street.TURN, Street.RIVER);
        assertThat(e.street()).isEqualTo(Street.WAITING);
        assertThat(chips(e)).isEqualTo(900);
    }

    @Test
    void shortBigBlind_isAllIn_andBoardRunsImmediately() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 5);

        assertThat(e.startNewHand()).isTrue();

        assertThat(eventsOf(TableEvent.HandComplete.class)).hasSize(1);
        assertThat(eventsOf(TableEvent.PlayerTurn.class)).isEmpty();
        assertThat(e.street()).isEqualTo(Street.WAITING);
        assertThat(chips(e)).isEqualTo(1005);
    }

    // ------------------------------------------------------------
    // SHOWDOWN
    // ------------------------------------------------------------
    private static void checkDown(TableEngine e) {
        while (e.street() != Street.WAITING) {
            Integer seat = e.activeSeat();
            boolean canCheck = e.getValidActions(seat).stream().anyMatch(a -> a.action() == ActionType.CHECK);
            assertThat(e.processAction(seat, canCheck ? ActionType.CHECK : ActionType.CALL, 0).accepted()).isTrue();
        }
    }

    @Test
    void splitPot_oddChipGoesFirstClockwiseFromButton() {
        // dealt from the small blind (seat 2): 2,3,1,2,3,1 then burn/flop/burn/turn/burn/river
        TableEngine e = stacked(6, PokerVariant.HOLDEM,
                "7c", "2c", "2h", "8c", "3d", "3s",
                "4c", "Ah", "Kd", "Qs", "5c", "Jc", "6c", "Td");
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        seat(e, 3, "c", 1000);
        e.startNewHand();

        e.processAction(1, ActionType.CALL, 0);
        e.processAction(2, ActionType.FOLD, 0);
        checkDown(e);

        TableEvent.HandComplete done = eventsOf(TableEvent.HandComplete.class).get(0);
        assertThat(done.totalAwarded()).isEqualTo(25);
        assertThat(done.awards()).extracting(TableEvent.Award::playerId).containsExactly("c", "a");
        assertThat(done.awards()).extracting(TableEvent.Award::amount).containsExactly(13L, 12L);
        assertThat(done.awards().get(0).handDescription()).isEqualTo("Straight, Ace high");

        TableView v = e.getState();
        assertThat(seatView(v, 1).chipStack()).isEqualTo(1002);
        assertThat(seatView(v, 2).chipStack()).isEqualTo(995);
        assertThat(seatView(v, 3).chipStack()).isEqualTo(1003);
    }

    @Test
    void omahaHiLo_splitsHighAndLow() {
        TableEngine e = stacked(6, PokerVariant.OMAHA_HI_LO,
                "As", "2h", "Ks", "3h", "Qd", "9c", "Jd", "9d",
                "6c", "4c", "5d", "8s", "7c", "Kh", "Tc", "Kc");
        seat(e, 1, "hi", 1000);
        seat(e, 2, "lo", 1000);
        e.startNewHand();
        assertThat(seatView(e.getState(), 1).holeCards()).hasSize(4);

        checkDown(e);

        TableEvent.HandComplete done = eventsOf(TableEvent.HandComplete.class).get(0);
        assertThat(done.awards()).hasSize(2);
        assertThat(done.awards()).filteredOn(a -> !a.low()).singleElement()
                .satisfies(a -> {
                    assertThat(a.playerId()).isEqualTo("hi");
                    assertThat(a.amount()).isEqualTo(10);
                });
        assertThat(done.awards()).filteredOn(TableEvent.Award::low).singleElement()
                .satisfies(a -> {
                    assertThat(a.playerId()).isEqualTo("lo");
                    assertThat(a.amount()).isEqualTo(10);
                    assertThat(a.handDescription()).isEqualTo("8-5-4-3-2 low");
                });
    }

    // ------------------------------------------------------------
    // REMOVAL / SIT OUT
    // ------------------------------------------------------------
    @Test
    void removePlayer_refusedWhileLive_allowedAfterFold() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        seat(e, 3, "c", 1000);
        e.startNewHand();

        assertThat(e.removePlayer(2)).isEmpty();
        e.processAction(1, ActionType.FOLD, 0);
        assertThat(e.removePlayer(1)).hasValueSatisfying(p -> assertThat(p.getId()).isEqualTo("a"));
        assertThat(eventsOf(TableEvent.PlayerLeft.class)).hasSize(1);
        assertThat(e.removePlayer(1)).isEmpty();
    }

    @Test
    void foldedWithUncollectedBet_staysSeatedUntilStreetCloses() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        seat(e, 3, "c", 1000);
        e.startNewHand();
        long before = chips(e);

        e.processAction(1, ActionType.CALL, 0);
        e.processAction(2, ActionType.FOLD, 0);
        assertThat(e.removePlayer(2)).isEmpty();

        e.processAction(3, ActionType.CHECK, 0);

        TableView v = e.getState();
        assertThat(v.street()).isEqualTo(Street.FLOP);
        assertThat(v.potTotal()).isEqualTo(25);
        assertThat(chips(e)).isEqualTo(before);

        // mises ramassées: le siège peut se libérer
        assertThat(e.removePlayer(2)).isPresent();
        assertThat(e.getState().potTotal()).isEqualTo(25);
    }

    @Test
    void sitOutMidHand_appliesAtHandEnd() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        e.startNewHand();

        e.sitOut(2);
        assertThat(seatView(e.getState(), 2).status()).isEqualTo(PlayerStatus.ACTIVE);
        e.processAction(1, ActionType.FOLD, 0);
        assertThat(seatView(e.getState(), 2).status()).isEqualTo(PlayerStatus.SITTING_OUT);
        assertThat(e.canStartHand()).isFalse();
    }

    @Test
    void topUp_onlyBetweenHands_withinMaxBuyIn() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);

        assertThat(e.topUp(1, 500).ok()).isTrue();
        assertThat(e.topUp(1, 9_000).reason()).isEqualTo(RejectReason.BUY_IN_TOO_LARGE);
        assertThat(e.topUp(4, 10).reason()).isEqualTo(RejectReason.SEAT_EMPTY);

        e.startNewHand();
        assertThat(e.topUp(2, 10).reason()).isEqualTo(RejectReason.HAND_IN_PROGRESS);
    }

    // ------------------------------------------------------------
    // VIEWS
    // ------------------------------------------------------------
    @Test
    void playerView_showsOnlyOwnHoleCards() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        e.startNewHand();

        TableView forA = e.getPlayerState("a");
        assertThat(seatView(forA, 1).holeCards()).hasSize(2);
        assertThat(seatView(forA, 1).hero()).isTrue();
        assertThat(seatView(forA, 2).holeCards()).isNull();

        TableView sanitized = e.getState().sanitized();
        assertThat(sanitized.seats()).allMatch(s -> s.holeCards() == null);
        assertThat(seatView(e.getState(), 2).holeCards()).hasSize(2);

        assertThat(forA.handHistory()).allMatch(h -> h.type() != HandHistoryEntry.Type.CARD_DEALT || h.cards().isEmpty());
    }

    @Test
    void views_areDetachedCopies() {
        TableEngine e = engine(6);
        seat(e, 1, "a", 1000);
        seat(e, 2, "b", 1000);
        TableView before = e.getState();
        e.startNewHand();

        assertThat(before.street()).isEqualTo(Street.WAITING);
        assertThat(seatView(before, 1).chipStack()).isEqualTo(1000);
        assertThatThrownBy(() -> before.seats().add(null)).isInstanceOf(UnsupportedOperationException.class);
    }
}
