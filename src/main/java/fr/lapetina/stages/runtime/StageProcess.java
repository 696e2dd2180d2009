package fr.lapetina.stages.runtime;

import fr.lapetina.stages.disruptor.MessageHandler;
import fr.lapetina.stages.domain.dispatcher.Dispatcher;
import fr.lapetina.stages.domain.dispatcher.SubscriberChannel;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.DemandRequest;
import fr.lapetina.stages.domain.model.ErrorType;
import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.Role;
import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.domain.stage.Reply;
import fr.lapetina.stages.domain.stage.StageHandler;
import fr.lapetina.stages.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.stages.runtime.exception.HandlerException;
import fr.lapetina.stages.runtime.exception.StageException;
import fr.lapetina.stages.runtime.exception.SubscribeException;
import fr.lapetina.stages.runtime.message.Ask;
import fr.lapetina.stages.runtime.message.Cancel;
import fr.lapetina.stages.runtime.message.CancelRequest;
import fr.lapetina.stages.runtime.message.Events;
import fr.lapetina.stages.runtime.message.Inspect;
import fr.lapetina.stages.runtime.message.ManualAsk;
import fr.lapetina.stages.runtime.message.SetDemandMode;
import fr.lapetina.stages.runtime.message.StageMessage;
import fr.lapetina.stages.runtime.message.Stop;
import fr.lapetina.stages.runtime.message.Subscribe;
import fr.lapetina.stages.runtime.message.SubscribeAccepted;
import fr.lapetina.stages.runtime.message.SubscribeRejected;
import fr.lapetina.stages.runtime.message.SubscribeUpstream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Behaviour of one stage: reacts to the messages of its mailbox.
 *
 * Everything in here runs on the stage's mailbox thread, one message at a
 * time, so none of the fields need synchronization.
 *
 * Upstream side (producing stages): {@code consumers} maps each downstream
 * subscription to its stage, the {@link Dispatcher} owns their demand, and
 * {@code pendingDemand} is what the dispatcher granted and the stage has not
 * produced yet. Produced events that find no demand wait in {@code buffer}.
 *
 * Downstream side (consuming stages): {@code producers} holds one
 * {@link ConsumerSubscription} per upstream link. A producer-consumer queues
 * upstream batches in {@code inbound} and only hands them to its handler
 * while it has downstream demand.
 */
final class StageProcess<I, O, S> implements MessageHandler<StageMessage> {

    private static final Logger log = LoggerFactory.getLogger(StageProcess.class);

    private final StageRef self;
    private final Role role;
    private final StageHandler<I, O, S> handler;
    private final Dispatcher<O> dispatcher;
    private final MetricsRegistry metrics;
    private final TerminationListener terminationListener;
    private final int bufferWarningThreshold;

    private final Map<SubscriptionTag, StageRef> consumers = new LinkedHashMap<>();
    private final Map<SubscriptionTag, ConsumerSubscription> producers = new LinkedHashMap<>();
    private final Map<SubscriptionTag, PendingSubscribe> pending = new HashMap<>();
    private final ArrayDeque<O> buffer = new ArrayDeque<>();
    private final ArrayDeque<InboundBatch<I>> inbound = new ArrayDeque<>();

    // One handler per message type, as the mailbox carries final records
    private final Map<Class<? extends StageMessage>, Consumer<StageMessage>> liveHandlers = new HashMap<>();
    private final Map<Class<? extends StageMessage>, Consumer<StageMessage>> terminatedHandlers = new HashMap<>();

    private S state;
    private DemandMode demandMode;
    private long pendingDemand;
    private boolean alive = true;
    private Reason terminationReason;
    private boolean bufferWarningLogged;

    StageProcess(
            StageRef self,
            StageSpec<I, O, S> spec,
            Dispatcher<O> dispatcher,
            MetricsRegistry metrics,
            TerminationListener terminationListener,
            int bufferWarningThreshold
    ) {
        this.self = self;
        this.role = spec.role();
        this.handler = spec.handler();
        this.state = spec.initialState();
        this.demandMode = spec.demandMode();
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.terminationListener = terminationListener;
        this.bufferWarningThreshold = bufferWarningThreshold;
        registerLiveHandlers();
        registerTerminatedHandlers();
    }

    @Override
    public void onMessage(StageMessage message) {
        if (!alive) {
            handleWhileTerminated(message);
            return;
        }

        try {
            handle(message);
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void handle(StageMessage message) {
        Consumer<StageMessage> action = liveHandlers.get(message.getClass());
        if (action == null) {
            log.warn("Unknown message ignored: stage={}, message={}", self, message);
            return;
        }
        action.accept(message);
    }

    private void registerLiveHandlers() {
        on(liveHandlers, Events.class, this::onEvents);
        on(liveHandlers, Ask.class, this::onAsk);
        on(liveHandlers, Subscribe.class, this::onSubscribe);
        on(liveHandlers, SubscribeUpstream.class, this::onSubscribeUpstream);
        on(liveHandlers, SubscribeAccepted.class, this::onSubscribeAccepted);
        on(liveHandlers, SubscribeRejected.class, this::onSubscribeRejected);
        on(liveHandlers, Cancel.class, this::onCancel);
        on(liveHandlers, CancelRequest.class, this::onCancelRequest);
        on(liveHandlers, ManualAsk.class, this::onManualAsk);
        on(liveHandlers, SetDemandMode.class, this::onSetDemandMode);
        on(liveHandlers, Inspect.class, inspect -> inspect.reply().complete(snapshot()));
        on(liveHandlers, Stop.class, stop -> terminate(stop.reason()));
    }

    private static <M extends StageMessage> void on(
            Map<Class<? extends StageMessage>, Consumer<StageMessage>> table, Class<M> type, Consumer<M> action) {
        table.put(type, message -> action.accept(type.cast(message)));
    }

    // ==================== EVENTS (DOWNSTREAM SIDE) ====================

    @SuppressWarnings("unchecked")
    private void onEvents(Events message) {
        ConsumerSubscription subscription = producers.get(message.tag());
        if (subscription == null) {
            log.debug("Events for unknown subscription dropped: stage={}, tag={}, count={}",
                    self, message.tag(), message.events().size());
            return;
        }

        List<I> events = (List<I>) message.events();
        subscription.onEventsReceived(events.size());
        metrics.recordEventsReceived(self.getName(), events.size());

        if (role == Role.CONSUMER) {
            Reply<O, S> reply = invoke("handleEvents", () -> handler.handleEvents(events, message.tag(), state));
            if (reply.hasEvents()) {
                throw new HandlerException(HandlerException.HandlerViolation.CONSUMER_EMITTED_EVENTS,
                        "stage=" + self + ", count=" + reply.events().size());
            }
            state = reply.state();
            refill(subscription, events.size());
        } else {
            inbound.add(new InboundBatch<>(message.tag(), events));
            processInbound();
        }
    }

    /**
     * Hands queued upstream events to a producer-consumer's handler, never
     * more than the downstream demand it currently has.
     */
    private void processInbound() {
        while (demandMode == DemandMode.FORWARD && pendingDemand > 0 && !inbound.isEmpty()) {
            InboundBatch<I> batch = inbound.peek();
            int take = (int) Math.min(pendingDemand, batch.remaining());
            List<I> chunk = batch.take(take);
            if (batch.remaining() == 0) {
                inbound.poll();
            }
            pendingDemand -= take;

            Reply<O, S> reply = invoke("handleEvents", () -> handler.handleEvents(chunk, batch.tag, state));
            state = reply.state();

            ConsumerSubscription subscription = producers.get(batch.tag);
            if (subscription != null) {
                refill(subscription, take);
            }
            emit(reply.events());
        }
    }

    private void refill(ConsumerSubscription subscription, int processed) {
        long ask = subscription.onEventsProcessed(processed);
        if (ask > 0) {
            sendAsk(subscription, ask);
        }
    }

    private void sendAsk(ConsumerSubscription subscription, long count) {
        subscription.upstream().send(new Ask(subscription.tag(), count));
        metrics.recordDemandRequested(self.getName(), count);
        log.debug("Demand asked: stage={}, tag={}, count={}, outstanding={}",
                self, subscription.tag(), count, subscription.outstanding());
    }

    // ==================== DEMAND (UPSTREAM SIDE) ====================

    private void onAsk(Ask ask) {
        if (!consumers.containsKey(ask.tag())) {
            log.debug("Ask for unknown subscription ignored: stage={}, tag={}", self, ask.tag());
            return;
        }
        long demand = dispatcher.ask(ask.tag(), ask.count());
        log.debug("Demand received: stage={}, tag={}, count={}, forwarded={}",
                self, ask.tag(), ask.count(), demand);
        addDemand(demand);
    }

    private void addDemand(long demand) {
        if (demand < 0) {
            // Demand withdrawn by a cancelled subscriber
            pendingDemand = Math.max(0, pendingDemand + demand);
            return;
        }
        pendingDemand += demand;
        int sent = flushBuffer();
        pendingDemand = Math.max(0, pendingDemand - sent);
        produce();
    }

    private void produce() {
        if (demandMode == DemandMode.ACCUMULATE || pendingDemand <= 0) {
            return;
        }

        if (role == Role.PRODUCER) {
            long demand = pendingDemand;
            Reply<O, S> reply = invoke("handleDemand", () -> handler.handleDemand(demand, state));
            if (reply.events().size() > demand) {
                throw new HandlerException(HandlerException.HandlerViolation.DEMAND_EXCEEDED,
                        "stage=" + self + ", demand=" + demand + ", returned=" + reply.events().size());
            }
            state = reply.state();
            pendingDemand -= reply.events().size();
            emit(reply.events());
        } else {
            processInbound();
        }
    }

    private void emit(List<O> events) {
        if (events.isEmpty()) {
            return;
        }
        if (dispatcher == null) {
            throw new HandlerException(HandlerException.HandlerViolation.CONSUMER_EMITTED_EVENTS,
                    "stage=" + self + ", count=" + events.size());
        }
        buffer.addAll(events);
        flushBuffer();
        checkBufferThreshold();
    }

    /**
     * Offers every buffered event to the dispatcher, keeping what it could not place.
     *
     * @return number of events dispatched
     */
    private int flushBuffer() {
        if (buffer.isEmpty()) {
            return 0;
        }
        List<O> batch = new ArrayList<>(buffer);
        List<O> leftovers = dispatcher.dispatch(batch);
        buffer.clear();
        buffer.addAll(leftovers);
        metrics.setBufferedEvents(self.getName(), buffer.size());
        return batch.size() - leftovers.size();
    }

    private void checkBufferThreshold() {
        if (buffer.size() >= bufferWarningThreshold && !bufferWarningLogged) {
            log.warn("Buffered events above threshold: stage={}, buffered={}, threshold={}",
                    self, buffer.size(), bufferWarningThreshold);
            bufferWarningLogged = true;
        } else if (buffer.size() < bufferWarningThreshold / 2) {
            bufferWarningLogged = false;
        }
    }

    private void onSetDemandMode(SetDemandMode message) {
        if (dispatcher == null) {
            log.warn("Demand mode ignored by consumer stage: stage={}", self);
            return;
        }
        DemandMode previous = demandMode;
        demandMode = message.mode();
        log.info("Demand mode changed: stage={}, {} -> {}, pendingDemand={}",
                self, previous, demandMode, pendingDemand);
        produce();
    }

    // ==================== SUBSCRIBE HANDSHAKE ====================

    private void onSubscribe(Subscribe message) {
        pending.put(message.tag(), new PendingSubscribe(message.upstream(), message.options(), message.reply()));
        if (!message.upstream().send(new SubscribeUpstream(message.tag(), self, message.options()))) {
            pending.remove(message.tag());
            message.reply().completeExceptionally(new SubscribeException(
                    SubscribeException.SubscribeRejection.STAGE_NOT_ALIVE, "upstream=" + message.upstream()));
        }
    }

    private void onSubscribeUpstream(SubscribeUpstream message) {
        SubscriptionTag tag = message.tag();
        long demand;
        try {
            demand = dispatcher.subscribe(new MailboxChannel(tag, message.downstream()), message.options());
        } catch (SubscribeException e) {
            log.warn("Subscription rejected: stage={}, tag={}, downstream={}, reason={}",
                    self, tag, message.downstream(), e.getRejection());
            metrics.recordSubscription(self.getName(), "rejected");
            message.downstream().send(new SubscribeRejected(tag, e));
            return;
        }

        consumers.put(tag, message.downstream());
        metrics.recordSubscription(self.getName(), "accepted");
        log.info("Subscription accepted: stage={}, tag={}, downstream={}, dispatcher={}",
                self, tag, message.downstream(), dispatcher.getName());
        message.downstream().send(new SubscribeAccepted(tag, self));

        state = timed("handleSubscribe", () -> handler.handleSubscribe(tag, true, state));
        if (demand > 0) {
            addDemand(demand);
        }
    }

    private void onSubscribeAccepted(SubscribeAccepted message) {
        PendingSubscribe request = pending.remove(message.tag());
        if (request == null) {
            log.debug("Accepted subscription no longer wanted, cancelling: stage={}, tag={}",
                    self, message.tag());
            message.upstream().send(new Cancel(message.tag(), Reason.normal("subscription abandoned")));
            return;
        }

        SubscriptionOptions options = request.options();
        ConsumerSubscription subscription = new ConsumerSubscription(
                message.tag(),
                message.upstream(),
                options.minDemand(),
                options.maxDemand(),
                options.cancelMode(),
                options.demandRequest()
        );
        producers.put(message.tag(), subscription);

        try {
            state = timed("handleSubscribe", () -> handler.handleSubscribe(message.tag(), false, state));
            if (subscription.demandRequest() == DemandRequest.AUTOMATIC) {
                sendAsk(subscription, subscription.initialAsk());
            }
        } catch (RuntimeException e) {
            request.reply().completeExceptionally(e);
            throw e;
        }

        log.info("Subscribed: stage={}, tag={}, upstream={}, window={}/{}, cancelMode={}, demand={}",
                self, message.tag(), message.upstream(), subscription.minDemand(), subscription.maxDemand(),
                subscription.cancelMode(), subscription.demandRequest());
        request.reply().complete(message.tag());
    }

    private void onSubscribeRejected(SubscribeRejected message) {
        PendingSubscribe request = pending.remove(message.tag());
        if (request != null) {
            request.reply().completeExceptionally(message.error());
        }
    }

    // ==================== CANCELLATION ====================

    private void onCancelRequest(CancelRequest message) {
        SubscriptionTag tag = message.tag();
        Reason reason = message.reason();

        ConsumerSubscription subscription = producers.remove(tag);
        if (subscription != null) {
            subscription.upstream().send(new Cancel(tag, reason));
            metrics.recordCancellation(self.getName());
            log.info("Subscription cancelled: stage={}, tag={}, side=downstream, reason={}", self, tag, reason);
            applyCancel(tag, reason);
            return;
        }

        PendingSubscribe request = pending.remove(tag);
        if (request != null) {
            request.reply().cancel(false);
            log.debug("Pending subscription abandoned: stage={}, tag={}", self, tag);
            return;
        }

        StageRef downstream = consumers.remove(tag);
        if (downstream != null) {
            long demand = dispatcher.cancel(tag);
            downstream.send(new Cancel(tag, reason));
            metrics.recordCancellation(self.getName());
            log.info("Subscription cancelled: stage={}, tag={}, side=upstream, reason={}", self, tag, reason);
            applyCancel(tag, reason);
            addDemand(demand);
            return;
        }

        log.debug("Cancel of unknown subscription ignored: stage={}, tag={}", self, tag);
    }

    private void onCancel(Cancel message) {
        SubscriptionTag tag = message.tag();
        Reason reason = message.reason();

        StageRef downstream = consumers.remove(tag);
        if (downstream != null) {
            long demand = dispatcher.cancel(tag);
            log.info("Downstream cancelled: stage={}, tag={}, downstream={}, reason={}",
                    self, tag, downstream, reason);
            applyCancel(tag, reason);
            addDemand(demand);
            return;
        }

        ConsumerSubscription subscription = producers.remove(tag);
        if (subscription != null) {
            log.info("Upstream cancelled: stage={}, tag={}, upstream={}, reason={}, cancelMode={}",
                    self, tag, subscription.upstream(), reason, subscription.cancelMode());
            applyCancel(tag, reason);
            if (subscription.cancelMode().terminatesOn(reason)) {
                terminate(reason);
            }
            return;
        }

        log.debug("Cancel for unknown subscription ignored: stage={}, tag={}", self, tag);
    }

    private void applyCancel(SubscriptionTag tag, Reason reason) {
        Reply<O, S> reply = invoke("handleCancel", () -> handler.handleCancel(tag, reason, state));
        state = reply.state();
        emit(reply.events());
    }

    // ==================== MANUAL DEMAND ====================

    private void onManualAsk(ManualAsk message) {
        ConsumerSubscription subscription = producers.get(message.tag());
        if (subscription == null) {
            log.debug("Ask on unknown subscription ignored: stage={}, tag={}", self, message.tag());
            return;
        }
        if (subscription.demandRequest() != DemandRequest.MANUAL) {
            log.warn("Ask ignored, subscription refills automatically: stage={}, tag={}", self, message.tag());
            return;
        }
        long granted = subscription.manualAsk(message.count());
        if (granted < message.count()) {
            log.warn("Ask clamped to demand window: stage={}, tag={}, requested={}, granted={}, max={}",
                    self, message.tag(), message.count(), granted, subscription.maxDemand());
        }
        if (granted > 0) {
            sendAsk(subscription, granted);
        }
    }

    // ==================== TERMINATION ====================

    private void fail(RuntimeException e) {
        ErrorType errorType = e instanceof StageException stageException
                ? stageException.getErrorType()
                : ErrorType.HANDLER_ERROR;
        log.error("Stage failed: stage={}, errorType={}", self, errorType, e);
        metrics.recordError(self.getName(), errorType);
        terminate(Reason.abnormal(e));
    }

    private void terminate(Reason reason) {
        if (!alive) {
            return;
        }
        alive = false;
        terminationReason = reason;

        for (Map.Entry<SubscriptionTag, StageRef> entry : consumers.entrySet()) {
            entry.getValue().send(new Cancel(entry.getKey(), reason));
        }
        for (ConsumerSubscription subscription : producers.values()) {
            subscription.upstream().send(new Cancel(subscription.tag(), reason));
        }
        for (PendingSubscribe request : pending.values()) {
            request.reply().completeExceptionally(new SubscribeException(
                    SubscribeException.SubscribeRejection.STAGE_NOT_ALIVE, "downstream=" + self + " " + reason));
        }

        long undelivered = buffer.size() + inboundCount();
        if (undelivered > 0) {
            log.warn("Stage terminated with undelivered events: stage={}, count={}", self, undelivered);
        }

        consumers.clear();
        producers.clear();
        pending.clear();
        buffer.clear();
        inbound.clear();

        try {
            handler.terminate(reason, state);
        } catch (RuntimeException e) {
            log.warn("Error in terminate callback: stage={}", self, e);
        }

        if (reason.isAbnormal()) {
            log.error("Stage terminated: stage={}, role={}, reason={}", self, role, reason);
        } else {
            log.info("Stage terminated: stage={}, role={}, reason={}", self, role, reason);
        }
        metrics.recordTermination(self.getName(), reason.kind());
        terminationListener.onTerminated(self, reason);
    }

    private void handleWhileTerminated(StageMessage message) {
        Consumer<StageMessage> action = terminatedHandlers.get(message.getClass());
        if (action == null) {
            log.debug("Message to terminated stage dropped: stage={}, message={}", self, message);
            return;
        }
        action.accept(message);
    }

    private void registerTerminatedHandlers() {
        on(terminatedHandlers, SubscribeUpstream.class, subscribe ->
                subscribe.downstream().send(new SubscribeRejected(subscribe.tag(), new SubscribeException(
                        SubscribeException.SubscribeRejection.STAGE_NOT_ALIVE, "upstream=" + self))));
        on(terminatedHandlers, Subscribe.class, subscribe ->
                subscribe.reply().completeExceptionally(new SubscribeException(
                        SubscribeException.SubscribeRejection.STAGE_NOT_ALIVE, "downstream=" + self)));
        on(terminatedHandlers, SubscribeAccepted.class, accepted ->
                accepted.upstream().send(new Cancel(accepted.tag(), terminationReason)));
        on(terminatedHandlers, Inspect.class, inspect -> inspect.reply().complete(snapshot()));
    }

    // ==================== HELPERS ====================

    /**
     * Runs a callback returning a {@link Reply}, which must not be null.
     */
    private <T> T invoke(String callback, Supplier<T> call) {
        T result = timed(callback, call);
        if (result == null) {
            throw new HandlerException(HandlerException.HandlerViolation.NULL_REPLY,
                    "stage=" + self + ", callback=" + callback);
        }
        return result;
    }

    /**
     * Runs a callback and records its latency. The result may be null: a
     * bare state is allowed to be.
     */
    private <T> T timed(String callback, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            return call.get();
        } finally {
            metrics.recordHandlerLatency(self.getName(), callback, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private long inboundCount() {
        long count = 0;
        for (InboundBatch<I> batch : inbound) {
            count += batch.remaining();
        }
        return count;
    }

    private StageSnapshot snapshot() {
        Map<String, Long> dispatcherDemand = new LinkedHashMap<>();
        if (dispatcher != null && alive) {
            dispatcher.outstandingDemand().forEach((tag, demand) -> dispatcherDemand.put(tag.value(), demand));
        }
        List<StageSnapshot.SubscriptionSnapshot> subscriptions = new ArrayList<>();
        for (ConsumerSubscription subscription : producers.values()) {
            subscriptions.add(StageSnapshot.SubscriptionSnapshot.of(subscription));
        }
        return new StageSnapshot(
                self.getId(),
                self.getName(),
                role,
                alive,
                demandMode,
                pendingDemand,
                buffer.size() + (dispatcher != null ? dispatcher.queuedEvents() : 0),
                inboundCount(),
                dispatcher != null ? dispatcher.getName() : null,
                dispatcherDemand,
                subscriptions
        );
    }

    private record PendingSubscribe(
            StageRef upstream,
            SubscriptionOptions options,
            CompletableFuture<SubscriptionTag> reply
    ) {
    }

    private static final class InboundBatch<I> {
        private final SubscriptionTag tag;
        private final List<I> events;
        private int offset;

        InboundBatch(SubscriptionTag tag, List<I> events) {
            this.tag = tag;
            this.events = events;
        }

        int remaining() {
            return events.size() - offset;
        }

        List<I> take(int count) {
            List<I> chunk = events.subList(offset, offset + count);
            offset += count;
            return chunk;
        }
    }

    /**
     * Dispatcher-facing end of a downstream subscription: delivers batches to
     * the subscriber's mailbox.
     */
    private final class MailboxChannel implements SubscriberChannel<O> {
        private final SubscriptionTag tag;
        private final StageRef downstream;

        MailboxChannel(SubscriptionTag tag, StageRef downstream) {
            this.tag = tag;
            this.downstream = downstream;
        }

        @Override
        public SubscriptionTag tag() {
            return tag;
        }

        @Override
        public void deliver(List<O> events) {
            if (downstream.send(new Events(tag, events))) {
                metrics.recordEventsDispatched(self.getName(), events.size());
            }
            log.debug("Events dispatched: stage={}, tag={}, downstream={}, count={}",
                    self, tag, downstream, events.size());
        }
    }
}
