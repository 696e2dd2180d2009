package fr.lapetina.stages.domain.dispatcher;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.exception.SubscribeException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default dispatcher: each event goes to exactly one subscriber.
 *
 * Events are handed out in chunks to the subscriber with the highest
 * outstanding demand, ties going to the earliest subscriber. This steers work
 * towards the consumer with the most free capacity without any explicit load
 * signal.
 */
public final class DemandDispatcher<E> implements Dispatcher<E> {

    private final List<Entry<E>> entries = new ArrayList<>();
    private final int maxSubscribers;

    public DemandDispatcher() {
        this(DispatcherConfig.UNLIMITED);
    }

    public DemandDispatcher(int maxSubscribers) {
        this.maxSubscribers = maxSubscribers;
    }

    @Override
    public String getName() {
        return "demand";
    }

    @Override
    public long subscribe(SubscriberChannel<E> channel, SubscriptionOptions options) {
        if (entries.size() >= maxSubscribers) {
            throw new SubscribeException(SubscribeException.SubscribeRejection.TOO_MANY_SUBSCRIBERS,
                    "max=" + maxSubscribers);
        }
        entries.add(new Entry<>(channel));
        return 0;
    }

    @Override
    public long cancel(SubscriptionTag tag) {
        Iterator<Entry<E>> it = entries.iterator();
        while (it.hasNext()) {
            Entry<E> entry = it.next();
            if (entry.channel.tag().equals(tag)) {
                it.remove();
                // Demand forwarded for this subscriber and not served yet is withdrawn
                return -entry.demand;
            }
        }
        return 0;
    }

    @Override
    public long ask(SubscriptionTag tag, long counter) {
        Entry<E> entry = find(tag);
        if (entry == null) {
            return 0;
        }
        entry.demand += counter;
        return counter;
    }

    @Override
    public List<E> dispatch(List<E> events) {
        int index = 0;
        int size = events.size();

        while (index < size) {
            Entry<E> best = highestDemand();
            if (best == null) {
                break;
            }
            int take = (int) Math.min(best.demand, size - index);
            best.channel.deliver(List.copyOf(events.subList(index, index + take)));
            best.demand -= take;
            index += take;
        }

        if (index == size) {
            return List.of();
        }
        return new ArrayList<>(events.subList(index, size));
    }

    private Entry<E> highestDemand() {
        Entry<E> best = null;
        for (Entry<E> entry : entries) {
            // Strictly greater keeps the earliest subscriber on ties
            if (entry.demand > 0 && (best == null || entry.demand > best.demand)) {
                best = entry;
            }
        }
        return best;
    }

    private Entry<E> find(SubscriptionTag tag) {
        for (Entry<E> entry : entries) {
            if (entry.channel.tag().equals(tag)) {
                return entry;
            }
        }
        return null;
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
        private long demand;

        Entry(SubscriberChannel<E> channel) {
            this.channel = channel;
        }
    }
}
