package fr.lapetina.stages.domain.dispatcher;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.exception.SubscribeException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Delivers every event to every subscriber.
 *
 * The producer is only asked for as many events as the least hungry
 * subscriber can take, so no subscriber ever receives more than it asked for.
 * As long as one subscriber has no demand, nothing new is requested.
 *
 * Subscribers may register a selector; events it rejects are skipped for
 * that subscriber but still count against its demand.
 */
public final class BroadcastDispatcher<E> implements Dispatcher<E> {

    private final List<Entry<E>> entries = new ArrayList<>();
    private final int maxSubscribers;

    // Demand forwarded to the producer and not yet dispatched
    private long requested;

    public BroadcastDispatcher() {
        this(DispatcherConfig.UNLIMITED);
    }

    public BroadcastDispatcher(int maxSubscribers) {
        this.maxSubscribers = maxSubscribers;
    }

    @Override
    public String getName() {
        return "broadcast";
    }

    @Override
    public long subscribe(SubscriberChannel<E> channel, SubscriptionOptions options) {
        if (entries.size() >= maxSubscribers) {
            throw new SubscribeException(SubscribeException.SubscribeRejection.TOO_MANY_SUBSCRIBERS,
                    "max=" + maxSubscribers);
        }
        entries.add(new Entry<>(channel, options.selector()));
        return 0;
    }

    @Override
    public long cancel(SubscriptionTag tag) {
        Iterator<Entry<E>> it = entries.iterator();
        while (it.hasNext()) {
            if (it.next().channel.tag().equals(tag)) {
                it.remove();
                return refreshRequested();
            }
        }
        return 0;
    }

    @Override
    public long ask(SubscriptionTag tag, long counter) {
        for (Entry<E> entry : entries) {
            if (entry.channel.tag().equals(tag)) {
                entry.demand += counter;
                return refreshRequested();
            }
        }
        return 0;
    }

    private long refreshRequested() {
        long extra = Math.max(0, minimumDemand() - requested);
        requested += extra;
        return extra;
    }

    /**
     * Smallest outstanding demand across subscribers, zero without subscribers.
     */
    long minimumDemand() {
        if (entries.isEmpty()) {
            return 0;
        }
        long min = Long.MAX_VALUE;
        for (Entry<E> entry : entries) {
            min = Math.min(min, entry.demand);
        }
        return min;
    }

    @Override
    public List<E> dispatch(List<E> events) {
        int deliverable = (int) Math.min(events.size(), minimumDemand());
        if (deliverable == 0) {
            return new ArrayList<>(events);
        }

        List<E> batch = List.copyOf(events.subList(0, deliverable));
        for (Entry<E> entry : entries) {
            List<E> selected = entry.select(batch);
            if (!selected.isEmpty()) {
                entry.channel.deliver(selected);
            }
            entry.demand -= deliverable;
        }
        requested = Math.max(0, requested - deliverable);

        if (deliverable == events.size()) {
            return List.of();
        }
        return new ArrayList<>(events.subList(deliverable, events.size()));
    }

    @Override
    public Map<SubscriptionTag, Long> outstandingDemand() {
        Map<SubscriptionTag, Long> result = new LinkedHashMap<>();
        for (Entry<E> entry : entries) {
            result.put(entry.channel.tag(), entry.demand);
        }
        return result;
    }

    @Override
    public int subscriberCount() {
        return entries.size();
    }

    private static final class Entry<E> {
        private final SubscriberChannel<E> channel;
        private final Predicate<Object> selector;
        private long demand;

        Entry(SubscriberChannel<E> channel, Predicate<Object> selector) {
            this.channel = channel;
            this.selector = selector;
        }

        List<E> select(List<E> batch) {
            if (selector == null) {
                return batch;
            }
            List<E> selected = new ArrayList<>(batch.size());
            for (E event : batch) {
                if (selector.test(event)) {
                    selected.add(event);
                }
            }
            return selected;
        }
    }
}
