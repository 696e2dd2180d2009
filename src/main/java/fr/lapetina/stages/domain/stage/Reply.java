package fr.lapetina.stages.domain.stage;

import java.util.List;

/**
 * Result of a handler invocation: the events to dispatch downstream and the
 * stage's new state.
 *
 * @param <O> type of emitted events
 * @param <S> type of the stage state
 */
public record Reply<O, S>(List<O> events, S state) {

    public Reply {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static <O, S> Reply<O, S> of(List<O> events, S state) {
        return new Reply<>(events, state);
    }

    public static <O, S> Reply<O, S> noReply(S state) {
        return new Reply<>(List.of(), state);
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }
}
