package fr.lapetina.stages.domain.stage;

import fr.lapetina.stages.domain.model.SubscriptionTag;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Ready-made handlers for common stage shapes.
 */
public final class Producers {

    private Producers() {
        // Utility class
    }

    /**
     * Producer emitting the elements of an iterator, as many as demanded.
     * Once exhausted, demand stays pending.
     */
    public static <O> StageHandler<Void, O, Iterator<O>> fromIterator() {
        return new StageHandler<>() {
            @Override
            public Reply<O, Iterator<O>> handleDemand(long demand, Iterator<O> source) {
                List<O> events = new ArrayList<>();
                while (events.size() < demand && source.hasNext()) {
                    events.add(source.next());
                }
                return Reply.of(events, source);
            }
        };
    }

    /**
     * Producer-consumer applying a function to every upstream event.
     */
    public static <I, O> StageHandler<I, O, Void> mapping(Function<? super I, ? extends O> mapper) {
        return new StageHandler<>() {
            @Override
            public Reply<O, Void> handleEvents(List<I> events, SubscriptionTag from, Void state) {
                List<O> out = new ArrayList<>(events.size());
                for (I event : events) {
                    out.add(mapper.apply(event));
                }
                return Reply.of(out, state);
            }
        };
    }

    /**
     * Consumer passing every event to a side-effecting callback.
     */
    public static <I> StageHandler<I, Void, Void> forEach(Consumer<? super I> action) {
        return new StageHandler<>() {
            @Override
            public Reply<Void, Void> handleEvents(List<I> events, SubscriptionTag from, Void state) {
                events.forEach(action);
                return Reply.noReply(state);
            }
        };
    }
}
