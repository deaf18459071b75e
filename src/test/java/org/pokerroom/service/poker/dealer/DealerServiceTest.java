package org.pokerroom.service.poker.dealer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.pokerroom.dto.poker.TableSnapshot;
import org.pokerroom.dto.poker.TableView;
import org.pokerroom.model.poker.*;
import org.pokerroom.service.poker.access.TableBroadcaster;
import org.pokerroom.service.poker.engine.ActionResult;
import org.pokerroom.service.poker.engine.RejectReason;
import org.pokerroom.service.poker.util.Locks;
import org.pokerroom.service.poker.util.Timeouts;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DealerServiceTest {

    private static final Long TABLE = 3L;

    @Mock Timeouts timeouts;
    @Mock TableBroadcaster broadcaster;
    @Mock SnapshotSink snapshots;

    DealerService dealer;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        TableConfig cfg = TableConfig.builder()
                .id(TABLE).name("dealer").tableSize(6)
                .smallBlind(5).bigBlind(10)
                .minBuyIn(100).maxBuyIn(2000)
                .timeLimitSeconds(20)
                .build();
        dealer = new DealerService(cfg, new Deck(new Random(17)), timeouts, new Locks(), broadcaster, snapshots, 1500);
    }

    private void seatTwo() {
        assertThat(dealer.seat("a", "Alice", 1, 1000).ok()).isTrue();
        assertThat(dealer.seat("b", "Bob", 2, 1000).ok()).isTrue();
    }

    private Runnable lastTimer(String name) {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(timeouts, atLeastOnce()).schedule(eq(TABLE), eq(name), anyLong(), task.capture());
        return task.getValue();
    }

    private long stackOf(String playerId, int seat) {
        return dealer.viewFor(playerId).seats().get(seat - 1).chipStack();
    }

    @Test
    void secondPlayer_startsHand_andArmsTurnClock() {
        dealer.seat("a", "Alice", 1, 1000);
        assertThat(dealer.publicView().street()).isEqualTo(Street.WAITING);

        dealer.seat("b", "Bob", 2, 1000);

        TableView v = dealer.publicView();
        assertThat(v.street()).isEqualTo(Street.PREFLOP);
        assertThat(v.activePlayerSeat()).isEqualTo(1);
        verify(timeouts).schedule(eq(TABLE), eq(DealerService.TURN_TIMER), eq(20_000L), any());
        verify(snapshots, atLeastOnce()).write(any(TableSnapshot.class));
    }

    @Test
    void relayedState_neverCarriesHoleCardsBeforeShowdown() {
        seatTwo();

        ArgumentCaptor<Object> payloads = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster, atLeastOnce()).toTable(eq(TABLE), eq("TABLE_STATE"), anyLong(), payloads.capture());
        assertThat(payloads.getAllValues()).allSatisfy(p -> {
            TableView v = (TableView) p;
            assertThat(v.seats()).allMatch(s -> s.holeCards() == null);
        });

        ArgumentCaptor<Object> mine = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster, atLeastOnce()).toPlayer(eq("a"), eq(TABLE), eq("PRIVATE_STATE"), anyLong(), mine.capture());
        TableView own = (TableView) mine.getValue();
        assertThat(own.seats().get(0).holeCards()).hasSize(2);
        assertThat(own.seats().get(1).holeCards()).isNull();
    }

    @Test
    void expiredClock_foldsWhenFacingBet() {
        seatTwo();

        lastTimer(DealerService.TURN_TIMER).run();

        assertThat(dealer.publicView().street()).isEqualTo(Street.WAITING);
        assertThat(stackOf("b", 2)).isEqualTo(1005);
        verify(timeouts).schedule(eq(TABLE), eq(DealerService.START_TIMER), eq(1500L), any());
        verify(timeouts, atLeastOnce()).cancel(TABLE, DealerService.TURN_TIMER);
    }

    @Test
    void expiredClock_checksWhenNothingOwed() {
        seatTwo();
        assertThat(dealer.act("a", ActionType.CALL, 0).accepted()).isTrue();

        lastTimer(DealerService.TURN_TIMER).run();

        TableView v = dealer.publicView();
        assertThat(v.street()).isEqualTo(Street.FLOP);
        assertThat(v.potTotal()).isEqualTo(20);
    }

    @Test
    void humanAction_cancelsClock_andStaleTimerIsIgnored() {
        seatTwo();
        Runnable forSeatOne = lastTimer(DealerService.TURN_TIMER);

        dealer.act("a", ActionType.CALL, 0);
        verify(timeouts).cancel(TABLE, DealerService.TURN_TIMER);

        forSeatOne.run();

        TableView v = dealer.publicView();
        assertThat(v.street()).isEqualTo(Street.PREFLOP);
        assertThat(v.activePlayerSeat()).isEqualTo(2);
        assertThat(stackOf("a", 1)).isEqualTo(990);
    }

    @Test
    void rejectedAction_keepsTheSameClock() {
        seatTwo();

        ActionResult r = dealer.act("a", ActionType.CHECK, 0);

        assertThat(r.reason()).isEqualTo(RejectReason.ILLEGAL_ACTION);
        verify(timeouts, times(2)).schedule(eq(TABLE), eq(DealerService.TURN_TIMER), anyLong(), any());
        assertThat(dealer.publicView().activePlayerSeat()).isEqualTo(1);
    }

    @Test
    void unseatedPlayer_cannotAct() {
        seatTwo();
        assertThat(dealer.act("ghost", ActionType.FOLD, 0).reason()).isEqualTo(RejectReason.NOT_YOUR_SEAT);
    }

    @Test
    void settleTimer_startsNextHand() {
        seatTwo();
        dealer.act("a", ActionType.FOLD, 0);
        assertThat(dealer.publicView().street()).isEqualTo(Street.WAITING);

        lastTimer(DealerService.START_TIMER).run();

        TableView v = dealer.publicView();
        assertThat(v.handNumber()).isEqualTo(2);
        assertThat(v.dealerSeat()).isEqualTo(2);
    }

    @Test
    void leavingMidHand_freesSeatWhenHandEnds() {
        seatTwo();

        assertThat(dealer.leave("a")).isEqualTo(LeaveOutcome.LEAVING_AFTER_HAND);
        assertThat(dealer.publicView().seats().get(0).empty()).isFalse();

        dealer.act("a", ActionType.FOLD, 0);

        assertThat(dealer.publicView().seats().get(0).empty()).isTrue();
        assertThat(dealer.leave("a")).isEqualTo(LeaveOutcome.NOT_SEATED);
    }

    @Test
    void relayAndPersistenceFailures_doNotBlockPlay() {
        doThrow(new RuntimeException("broker down")).when(broadcaster).toTable(any(), anyString(), anyLong(), any());
        doThrow(new RuntimeException("db down")).when(snapshots).write(any());

        seatTwo();

        assertThat(dealer.act("a", ActionType.CALL, 0).accepted()).isTrue();
        assertThat(dealer.publicView().activePlayerSeat()).isEqualTo(2);
    }

    @Test
    void disconnect_sitsPlayerOutUntilReconnect() {
        dealer.seat("a", "Alice", 1, 1000);
        assertThat(dealer.disconnected("a")).isTrue();
        assertThat(dealer.viewFor("a").seats().get(0).status()).isEqualTo(PlayerStatus.DISCONNECTED);

        dealer.seat("b", "Bob", 2, 1000);
        assertThat(dealer.publicView().street()).isEqualTo(Street.WAITING);

        assertThat(dealer.reconnected("a")).isTrue();
        assertThat(dealer.publicView().street()).isEqualTo(Street.PREFLOP);
    }

    @Test
    void stop_cancelsEveryTimerOfTheTable() {
        dealer.stop();
        verify(timeouts).cancelAllOf(TABLE);
    }
}
