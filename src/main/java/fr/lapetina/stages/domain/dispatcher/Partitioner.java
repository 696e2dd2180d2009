package fr.lapetina.stages.domain.dispatcher;

/**
 * Maps an event to the name of the partition it belongs to.
 * Must be deterministic: equal inputs always give the same partition.
 */
@FunctionalInterface
public interface Partitioner<E> {

    String partition(E event);

    /**
     * Partitions named "0" to "count - 1", chosen from the event's hash code.
     */
    static <E> Partitioner<E> hashing(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Partition count must be positive");
        }
        return event -> String.valueOf(Math.floorMod(event.hashCode(), count));
    }
}
