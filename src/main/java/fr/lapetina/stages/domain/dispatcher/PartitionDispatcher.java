package fr.lapetina.stages.domain.dispatcher;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.exception.DispatchException;
import fr.lapetina.stages.runtime.exception.SubscribeException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes each event to a fixed partition chosen by a {@link Partitioner}.
 *
 * Each partition accepts at most one subscription at a time and keeps its
 * own FIFO queue, so order is preserved inside a partition but not across
 * partitions. Events waiting for demand stay in their partition's queue,
 * also across a resubscription.
 *
 * Events mapping to a partition that is unknown or has no subscriber are
 * rejected with a {@link DispatchException}.
 */
public final class PartitionDispatcher<E> implements Dispatcher<E> {

    private final Map<String, Partition<E>> partitions = new LinkedHashMap<>();
    private final Map<SubscriptionTag, Partition<E>> byTag = new HashMap<>();
    private final Partitioner<E> partitioner;
    private final int maxSubscribers;

    public PartitionDispatcher(List<String> names, Partitioner<E> partitioner) {
        this(names, partitioner, DispatcherConfig.UNLIMITED);
    }

    public PartitionDispatcher(List<String> names, Partitioner<E> partitioner, int maxSubscribers) {
        Objects.requireNonNull(partitioner, "Partitioner is required");
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("At least one partition is required");
        }
        for (String name : names) {
            if (partitions.put(name, new Partition<>(name)) != null) {
                throw new IllegalArgumentException("Duplicate partition: " + name);
            }
        }
        this.partitioner = partitioner;
        this.maxSubscribers = maxSubscribers;
    }

    @Override
    public String getName() {
        return "partition";
    }

    @Override
    public long subscribe(SubscriberChannel<E> channel, SubscriptionOptions options) {
        String name = options.partition();
        if (name == null) {
            throw new SubscribeException(SubscribeException.SubscribeRejection.MISSING_PARTITION,
                    "available=" + partitions.keySet());
        }
        Partition<E> partition = partitions.get(name);
        if (partition == null) {
            throw new SubscribeException(SubscribeException.SubscribeRejection.UNKNOWN_PARTITION,
                    "partition=" + name + ", available=" + partitions.keySet());
        }
        if (byTag.size() >= maxSubscribers) {
            throw new SubscribeException(SubscribeException.SubscribeRejection.TOO_MANY_SUBSCRIBERS,
                    "max=" + maxSubscribers);
        }
        if (partition.channel != null) {
            throw new SubscribeException(SubscribeException.SubscribeRejection.PARTITION_ALREADY_BOUND,
                    "partition=" + name + ", boundTo=" + partition.channel.tag());
        }
        partition.channel = channel;
        partition.demand = 0;
        byTag.put(channel.tag(), partition);
        return 0;
    }

    @Override
    public long cancel(SubscriptionTag tag) {
        Partition<E> partition = byTag.remove(tag);
        if (partition == null) {
            return 0;
        }
        long withdrawn = partition.demand;
        partition.channel = null;
        partition.demand = 0;
        return -withdrawn;
    }

    @Override
    public long ask(SubscriptionTag tag, long counter) {
        Partition<E> partition = byTag.get(tag);
        if (partition == null) {
            return 0;
        }
        partition.demand += counter;
        int served = partition.drain();
        return Math.max(0, counter - served);
    }

    @Override
    public List<E> dispatch(List<E> events) {
        // Resolve every event first so a bad one rejects the whole batch
        List<Partition<E>> targets = new ArrayList<>(events.size());
        for (E event : events) {
            String name = partitioner.partition(event);
            Partition<E> partition = partitions.get(name);
            if (partition == null) {
                throw new DispatchException(DispatchException.DispatchFailure.UNKNOWN_PARTITION, name);
            }
            if (partition.channel == null) {
                throw new DispatchException(DispatchException.DispatchFailure.UNBOUND_PARTITION, name);
            }
            targets.add(partition);
        }

        Set<Partition<E>> touched = new LinkedHashSet<>();
        for (int i = 0; i < events.size(); i++) {
            Partition<E> partition = targets.get(i);
            partition.queue.add(events.get(i));
            touched.add(partition);
        }
        for (Partition<E> partition : touched) {
            partition.drain();
        }
        return List.of();
    }

    @Override
    public Map<SubscriptionTag, Long> outstandingDemand() {
        Map<SubscriptionTag, Long> result = new LinkedHashMap<>();
        for (Partition<E> partition : partitions.values()) {
            if (partition.channel != null) {
                result.put(partition.channel.tag(), partition.demand);
            }
        }
        return result;
    }

    @Override
    public int subscriberCount() {
        return byTag.size();
    }

    @Override
    public int queuedEvents() {
        int total = 0;
        for (Partition<E> partition : partitions.values()) {
            total += partition.queue.size();
        }
        return total;
    }

    /**
     * Returns the configured partition names, in declaration order.
     */
    public Set<String> partitionNames() {
        return partitions.keySet();
    }

    private static final class Partition<E> {
        private final String name;
        private final ArrayDeque<E> queue = new ArrayDeque<>();
        private SubscriberChannel<E> channel;
        private long demand;

        Partition(String name) {
            this.name = name;
        }

        int drain() {
            if (channel == null || demand == 0 || queue.isEmpty()) {
                return 0;
            }
            int take = (int) Math.min(demand, queue.size());
            List<E> batch = new ArrayList<>(take);
            for (int i = 0; i < take; i++) {
                batch.add(queue.poll());
            }
            channel.deliver(batch);
            demand -= take;
            return take;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
