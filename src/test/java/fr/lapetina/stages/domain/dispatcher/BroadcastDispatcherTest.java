package fr.lapetina.stages.domain.dispatcher;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BroadcastDispatcherTest {

    private BroadcastDispatcher<Integer> dispatcher;
    private RecordingChannel<Integer> first;
    private RecordingChannel<Integer> second;

    @BeforeEach
    void setUp() {
        dispatcher = new BroadcastDispatcher<>();
        first = new RecordingChannel<>("first");
        second = new RecordingChannel<>("second");
        dispatcher.subscribe(first, SubscriptionOptions.defaults());
        dispatcher.subscribe(second, SubscriptionOptions.defaults());
    }

    @Test
    @DisplayName("should only request the lowest subscriber demand")
    void shouldRequestMinimumDemand() {
        assertThat(dispatcher.ask(first.tag(), 10)).isZero();
        assertThat(dispatcher.ask(second.tag(), 4)).isEqualTo(4);
        assertThat(dispatcher.ask(second.tag(), 10)).isEqualTo(6);
    }

    @Test
    @DisplayName("should deliver every event to every subscriber")
    void shouldDuplicateEvents() {
        dispatcher.ask(first.tag(), 5);
        dispatcher.ask(second.tag(), 5);

        List<Integer> leftovers = dispatcher.dispatch(List.of(1, 2, 3));

        assertThat(leftovers).isEmpty();
        assertThat(first.received()).containsExactly(1, 2, 3);
        assertThat(second.received()).containsExactly(1, 2, 3);
        assertThat(dispatcher.outstandingDemand().values()).containsOnly(2L);
    }

    @Test
    @DisplayName("should hold back events beyond the lowest demand")
    void shouldKeepEventsAboveMinimum() {
        dispatcher.ask(first.tag(), 5);
        dispatcher.ask(second.tag(), 2);

        List<Integer> leftovers = dispatcher.dispatch(List.of(1, 2, 3, 4));

        assertThat(first.received()).containsExactly(1, 2);
        assertThat(second.received()).containsExactly(1, 2);
        assertThat(leftovers).containsExactly(3, 4);
    }

    @Test
    @DisplayName("should skip events rejected by a subscriber's selector")
    void shouldApplySelector() {
        BroadcastDispatcher<Integer> filtered = new BroadcastDispatcher<>();
        RecordingChannel<Integer> all = new RecordingChannel<>("all");
        RecordingChannel<Integer> even = new RecordingChannel<>("even");
        filtered.subscribe(all, SubscriptionOptions.defaults());
        filtered.subscribe(even, SubscriptionOptions.builder().<Integer>selector(n -> n % 2 == 0).build());
        filtered.ask(all.tag(), 4);
        filtered.ask(even.tag(), 4);

        filtered.dispatch(List.of(1, 2, 3, 4));

        assertThat(all.received()).containsExactly(1, 2, 3, 4);
        assertThat(even.received()).containsExactly(2, 4);
        assertThat(filtered.outstandingDemand().get(even.tag())).isZero();
    }

    @Test
    @DisplayName("should release demand held back by a cancelled subscriber")
    void shouldRefreshDemandOnCancel() {
        dispatcher.ask(first.tag(), 8);
        dispatcher.ask(second.tag(), 3);

        assertThat(dispatcher.cancel(second.tag())).isEqualTo(5);
        assertThat(dispatcher.minimumDemand()).isEqualTo(8);
    }

    @Test
    @DisplayName("should keep everything without subscribers")
    void shouldKeepEventsWithoutSubscribers() {
        BroadcastDispatcher<Integer> empty = new BroadcastDispatcher<>();

        assertThat(empty.dispatch(List.of(1, 2))).containsExactly(1, 2);
        assertThat(empty.minimumDemand()).isZero();
    }
}
