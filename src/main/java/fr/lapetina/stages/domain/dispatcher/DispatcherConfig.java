package fr.lapetina.stages.domain.dispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dispatcher selection for a producing stage, fixed at stage start.
 *
 * @param type           which strategy to use
 * @param partitions     partition names, only for {@link DispatcherType#PARTITION}
 * @param partitioner    event to partition mapping, only for {@link DispatcherType#PARTITION}
 * @param maxSubscribers subscriber limit, {@link #UNLIMITED} by default
 */
public record DispatcherConfig(
        DispatcherType type,
        List<String> partitions,
        Partitioner<?> partitioner,
        int maxSubscribers
) {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public DispatcherConfig {
        Objects.requireNonNull(type, "Dispatcher type is required");
        if (maxSubscribers <= 0) {
            throw new IllegalArgumentException("maxSubscribers must be positive");
        }
        if (type == DispatcherType.PARTITION) {
            if (partitions == null || partitions.isEmpty()) {
                throw new IllegalArgumentException("Partition dispatcher requires partitions");
            }
            Objects.requireNonNull(partitioner, "Partition dispatcher requires a partitioner");
        }
        partitions = partitions != null ? List.copyOf(partitions) : List.of();
    }

    public static DispatcherConfig demand() {
        return new DispatcherConfig(DispatcherType.DEMAND, null, null, UNLIMITED);
    }

    public static DispatcherConfig broadcast() {
        return new DispatcherConfig(DispatcherType.BROADCAST, null, null, UNLIMITED);
    }

    /**
     * Partitions "0" to "count - 1", routed by {@link Partitioner#hashing}.
     */
    public static DispatcherConfig partition(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(String.valueOf(i));
        }
        return new DispatcherConfig(DispatcherType.PARTITION, names, Partitioner.hashing(count), UNLIMITED);
    }

    public static <E> DispatcherConfig partition(List<String> names, Partitioner<E> partitioner) {
        return new DispatcherConfig(DispatcherType.PARTITION, names, partitioner, UNLIMITED);
    }

    /**
     * Returns a copy limited to {@code max} concurrent subscribers.
     * With 1 the producing stage serves a single consumer.
     */
    public DispatcherConfig withMaxSubscribers(int max) {
        return new DispatcherConfig(type, partitions, partitioner, max);
    }
}
