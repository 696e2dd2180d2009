package fr.lapetina.stages.integration;

import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.domain.stage.Reply;
import fr.lapetina.stages.domain.stage.StageHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Consumer handler recording what it receives. Readable from the test thread.
 */
final class CollectingConsumer<E> implements StageHandler<E, Void, Void> {

    private final List<E> events = new CopyOnWriteArrayList<>();
    private final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
    private final List<Reason> cancellations = new CopyOnWriteArrayList<>();

    @Override
    public Reply<Void, Void> handleEvents(List<E> batch, SubscriptionTag from, Void state) {
        events.addAll(batch);
        batchSizes.add(batch.size());
        return Reply.noReply(state);
    }

    @Override
    public Reply<Void, Void> handleCancel(SubscriptionTag tag, Reason reason, Void state) {
        cancellations.add(reason);
        return Reply.noReply(state);
    }

    List<E> events() {
        return new ArrayList<>(events);
    }

    int count() {
        return events.size();
    }

    List<Integer> batchSizes() {
        return new ArrayList<>(batchSizes);
    }

    List<Reason> cancellations() {
        return new ArrayList<>(cancellations);
    }
}
