package fr.lapetina.stages.domain.dispatcher;

/**
 * Creates dispatcher instances from their configuration.
 * Each producing stage gets its own instance.
 */
public final class DispatcherFactory {

    private DispatcherFactory() {
        // Utility class
    }

    @SuppressWarnings("unchecked")
    public static <E> Dispatcher<E> create(DispatcherConfig config) {
        return switch (config.type()) {
            case DEMAND -> new DemandDispatcher<>(config.maxSubscribers());
            case BROADCAST -> new BroadcastDispatcher<>(config.maxSubscribers());
            case PARTITION -> new PartitionDispatcher<>(
                    config.partitions(), (Partitioner<E>) config.partitioner(), config.maxSubscribers());
        };
    }
}
