package fr.lapetina.stages.runtime;

import fr.lapetina.stages.domain.dispatcher.DispatcherConfig;
import fr.lapetina.stages.domain.model.CancelMode;
import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.domain.stage.Producers;
import fr.lapetina.stages.domain.stage.Reply;
import fr.lapetina.stages.domain.stage.StageHandler;
import fr.lapetina.stages.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.stages.runtime.exception.SubscribeException;
import fr.lapetina.stages.runtime.exception.SubscribeException.SubscribeRejection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.stages.integration.TestPipelineFactory.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageRuntimeTest {

    private StageRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = StageRuntime.builder()
                .ringBufferSize(64)
                .defaultDemand(5, 10)
                .defaultCancelMode(CancelMode.PERMANENT)
                .subscribeTimeoutMs(2000)
                .shutdownTimeoutMs(2000)
                .metricsRegistry(new MetricsRegistry("test", false))
                .build();
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private StageRef producer() {
        return runtime.startProducer("producer", Producers.<Integer>fromIterator(),
                Collections.<Integer>emptyIterator(), DispatcherConfig.demand());
    }

    private StageRef consumer() {
        return runtime.startConsumer("consumer", Producers.<Integer>forEach(n -> { }), null);
    }

    private static void assertRejected(Executable subscribe, SubscribeRejection rejection) {
        assertThatThrownBy(subscribe::execute)
                .isInstanceOf(SubscribeException.class)
                .satisfies(e -> assertThat(((SubscribeException) e).getRejection()).isEqualTo(rejection));
    }

    @Nested
    @DisplayName("subscribe")
    class SubscribeTests {

        @Test
        @DisplayName("should return a tag once both ends are linked")
        void shouldSubscribe() {
            StageRef producer = producer();
            StageRef consumer = consumer();

            SubscriptionTag tag = runtime.subscribe(consumer, producer);

            assertThat(tag).isNotNull();
            assertThat(runtime.inspect(consumer).orElseThrow().subscriptions()).hasSize(1);
        }

        @Test
        @DisplayName("should apply the default window and derive min from max")
        void shouldResolveDefaults() {
            StageRef producer = producer();
            StageRef consumer = consumer();

            runtime.subscribe(consumer, producer, SubscriptionOptions.builder().maxDemand(100).build());

            StageSnapshot.SubscriptionSnapshot sub = runtime.inspect(consumer).orElseThrow().subscriptions().get(0);
            assertThat(sub.maxDemand()).isEqualTo(100);
            assertThat(sub.minDemand()).isEqualTo(75);
            assertThat(sub.cancelMode()).isEqualTo(CancelMode.PERMANENT);
        }

        @Test
        @DisplayName("should reject an invalid demand window")
        void shouldRejectInvalidWindow() {
            StageRef producer = producer();
            StageRef consumer = consumer();

            assertRejected(() -> runtime.subscribe(consumer, producer,
                            SubscriptionOptions.builder().minDemand(10).maxDemand(10).build()),
                    SubscribeRejection.INVALID_DEMAND_WINDOW);
        }

        @Test
        @DisplayName("should reject a consumer as upstream")
        void shouldRejectConsumerUpstream() {
            StageRef first = consumer();
            StageRef second = consumer();

            assertRejected(() -> runtime.subscribe(first, second), SubscribeRejection.NOT_A_PRODUCER);
        }

        @Test
        @DisplayName("should reject a producer as downstream")
        void shouldRejectProducerDownstream() {
            StageRef first = producer();
            StageRef second = producer();

            assertRejected(() -> runtime.subscribe(first, second), SubscribeRejection.NOT_A_CONSUMER);
        }

        @Test
        @DisplayName("should reject a terminated upstream")
        void shouldRejectDeadUpstream() throws Exception {
            StageRef producer = producer();
            StageRef consumer = consumer();
            runtime.stop(producer);
            producer.terminationFuture().get(2, TimeUnit.SECONDS);

            assertRejected(() -> runtime.subscribe(consumer, producer), SubscribeRejection.STAGE_NOT_ALIVE);
        }

        @Test
        @DisplayName("should surface dispatcher rejections from the upstream stage")
        void shouldPropagateDispatcherRejection() {
            StageRef producer = runtime.startProducer("single", Producers.<Integer>fromIterator(),
                    Collections.<Integer>emptyIterator(), DispatcherConfig.demand().withMaxSubscribers(1));
            runtime.subscribe(consumer(), producer);

            assertRejected(() -> runtime.subscribe(consumer(), producer), SubscribeRejection.TOO_MANY_SUBSCRIBERS);
        }

        @Test
        @DisplayName("should link stages whose state is null")
        void shouldSubscribeWithNullState() {
            List<Integer> seen = new CopyOnWriteArrayList<>();
            StageRef producer = runtime.startProducer("numbers", Producers.<Integer>fromIterator(),
                    List.of(1, 2, 3).iterator(), DispatcherConfig.demand());
            StageRef doubler = runtime.startProducerConsumer("doubler",
                    Producers.<Integer, Integer>mapping(n -> n * 2), null, DispatcherConfig.demand());
            StageRef consumer = runtime.startConsumer("sink", Producers.<Integer>forEach(seen::add), null);

            runtime.subscribe(doubler, producer);
            runtime.subscribe(consumer, doubler, SubscriptionOptions.builder().minDemand(5).maxDemand(10).build());

            await("three events", () -> seen.size() == 3);
            assertThat(seen).containsExactly(2, 4, 6);
            assertThat(consumer.isAlive()).isTrue();
            assertThat(doubler.isAlive()).isTrue();
        }

        @Test
        @DisplayName("should time out when the upstream does not answer and drop the late link")
        void shouldTimeOutOnBusyUpstream() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            StageHandler<Void, Integer, Void> stalling = new StageHandler<>() {
                @Override
                public Reply<Integer, Void> handleDemand(long demand, Void state) {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Reply.noReply(state);
                }
            };

            try (StageRuntime impatient = StageRuntime.builder()
                    .ringBufferSize(64)
                    .defaultDemand(5, 10)
                    .subscribeTimeoutMs(200)
                    .shutdownTimeoutMs(2000)
                    .metricsRegistry(new MetricsRegistry("timeout", false))
                    .build()) {
                StageRef producer = impatient.startProducer("stalling", stalling, null, DispatcherConfig.demand());
                StageRef first = impatient.startConsumer("first", Producers.<Integer>forEach(n -> { }), null);
                StageRef late = impatient.startConsumer("late", Producers.<Integer>forEach(n -> { }), null);

                // The first ask leaves the producer thread stuck in handleDemand
                SubscriptionTag kept = impatient.subscribe(first, producer);

                assertThatThrownBy(() -> impatient.subscribe(late, producer))
                        .isInstanceOf(SubscribeException.class)
                        .satisfies(e -> assertThat(((SubscribeException) e).getRejection())
                                .isEqualTo(SubscribeRejection.TIMEOUT));

                release.countDown();

                await("late subscription dropped by the producer", () ->
                        impatient.inspect(producer).orElseThrow().dispatcherDemand().keySet()
                                .equals(Set.of(kept.value())));
                assertThat(impatient.inspect(late).orElseThrow().subscriptions()).isEmpty();
                assertThat(late.isAlive()).isTrue();
                assertThat(producer.isAlive()).isTrue();
            }
        }

        @Test
        @DisplayName("should accept several subscriptions between the same stages")
        void shouldAllowParallelSubscriptions() {
            StageRef producer = producer();
            StageRef consumer = consumer();

            SubscriptionTag first = runtime.subscribe(consumer, producer);
            SubscriptionTag second = runtime.subscribe(consumer, producer);

            assertThat(first).isNotEqualTo(second);
            assertThat(runtime.inspect(producer).orElseThrow().dispatcherDemand()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("cancel")
    class CancelTests {

        @Test
        @DisplayName("should remove the subscription on both ends")
        void shouldCancelFromConsumer() throws Exception {
            StageRef producer = producer();
            StageRef consumer = consumer();
            SubscriptionTag tag = runtime.subscribe(consumer, producer);

            runtime.cancel(consumer, tag);

            assertThat(runtime.inspect(consumer).orElseThrow().subscriptions()).isEmpty();
            awaitEmptyDispatcher(producer);
            assertThat(consumer.isAlive()).isTrue();
            assertThat(producer.isAlive()).isTrue();
        }

        @Test
        @DisplayName("should keep a temporary consumer alive when the producer cancels")
        void shouldCancelFromProducer() {
            StageRef producer = producer();
            StageRef consumer = consumer();
            SubscriptionTag tag = runtime.subscribe(consumer, producer,
                    SubscriptionOptions.builder().cancelMode(CancelMode.TEMPORARY).build());

            runtime.cancel(producer, tag);

            assertThat(runtime.inspect(producer).orElseThrow().dispatcherDemand()).isEmpty();
            assertThat(runtime.inspect(consumer).orElseThrow().subscriptions()).isEmpty();
            assertThat(consumer.isAlive()).isTrue();
        }

        @Test
        @DisplayName("should withdraw the demand a cancelled consumer left unserved")
        void shouldWithdrawPendingDemand() {
            StageRef producer = producer();
            StageRef consumer = consumer();
            SubscriptionTag tag = runtime.subscribe(consumer, producer,
                    SubscriptionOptions.builder().cancelMode(CancelMode.TEMPORARY).build());
            await("demand reaches the producer", () -> runtime.inspect(producer).orElseThrow().pendingDemand() == 10);

            runtime.cancel(consumer, tag);

            await("demand withdrawn", () -> runtime.inspect(producer).orElseThrow().pendingDemand() == 0);
            assertThat(runtime.inspect(producer).orElseThrow().dispatcherDemand()).isEmpty();
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldCancelIdempotently() {
            StageRef producer = producer();
            StageRef consumer = consumer();
            SubscriptionTag tag = runtime.subscribe(consumer, producer);

            runtime.cancel(consumer, tag);
            runtime.cancel(consumer, tag);
            runtime.cancel(consumer, SubscriptionTag.random());

            assertThat(runtime.inspect(consumer).orElseThrow().alive()).isTrue();
            assertThat(consumer.isAlive()).isTrue();
        }

        @Test
        @DisplayName("should ignore cancels on a terminated stage")
        void shouldIgnoreCancelOnDeadStage() throws Exception {
            StageRef consumer = consumer();
            runtime.stop(consumer);
            consumer.terminationFuture().get(2, TimeUnit.SECONDS);

            runtime.cancel(consumer, SubscriptionTag.random());

            assertThat(consumer.isAlive()).isFalse();
        }

        private void awaitEmptyDispatcher(StageRef producer) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 2000;
            while (!runtime.inspect(producer).orElseThrow().dispatcherDemand().isEmpty()) {
                assertThat(System.currentTimeMillis()).isLessThan(deadline);
                Thread.sleep(10);
            }
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should list running stages and forget terminated ones")
        void shouldTrackStages() throws Exception {
            StageRef producer = producer();
            StageRef consumer = consumer();

            assertThat(runtime.getStages()).containsExactly(producer, consumer);
            assertThat(runtime.findStage(producer.getId())).contains(producer);

            runtime.stop(producer);
            producer.terminationFuture().get(2, TimeUnit.SECONDS);

            assertThat(runtime.getStages()).containsExactly(consumer);
        }

        @Test
        @DisplayName("should terminate every stage with a shutdown reason on close")
        void shouldShutdownOnClose() throws Exception {
            StageRef producer = producer();
            StageRef consumer = consumer();
            runtime.subscribe(consumer, producer);

            runtime.close();

            assertThat(producer.terminationFuture().get(2, TimeUnit.SECONDS).kind()).isEqualTo(Reason.Kind.SHUTDOWN);
            assertThat(consumer.terminationFuture().get(2, TimeUnit.SECONDS).kind()).isEqualTo(Reason.Kind.SHUTDOWN);
            assertThat(runtime.getStages()).isEmpty();
            assertThat(runtime.getMetricsRegistry().getRunningStages()).isZero();
            assertThatThrownBy(() -> consumer())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should apply updated defaults to later subscriptions only")
        void shouldUpdateDefaults() {
            StageRef producer = producer();
            StageRef consumer = consumer();
            runtime.subscribe(consumer, producer);

            runtime.updateDefaults(20, 40, CancelMode.TRANSIENT);
            runtime.subscribe(consumer, producer);

            assertThat(runtime.inspect(consumer).orElseThrow().subscriptions())
                    .extracting(StageSnapshot.SubscriptionSnapshot::maxDemand)
                    .containsExactly(10, 40);
        }
    }
}
