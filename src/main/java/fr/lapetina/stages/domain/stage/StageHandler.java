package fr.lapetina.stages.domain.stage;

import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.exception.HandlerException;

import java.util.List;

/**
 * User callbacks of a stage.
 *
 * All callbacks run on the stage's own thread, one at a time, so the state
 * never needs synchronization. The state passed in is the one returned by the
 * previous callback. Throwing from any callback terminates the stage.
 *
 * Which callbacks must be implemented depends on the role:
 * - PRODUCER: {@link #handleDemand}
 * - PRODUCER_CONSUMER: {@link #handleEvents}, optionally {@link #handleDemand}
 * - CONSUMER: {@link #handleEvents}, returning no events
 *
 * @param <I> type of events received from upstream
 * @param <O> type of events emitted downstream
 * @param <S> type of the stage state
 */
public interface StageHandler<I, O, S> {

    /**
     * Called when downstream demand is available.
     *
     * @param demand number of events the stage may emit, always positive
     * @param state  current state
     * @return at most {@code demand} events and the new state
     */
    default Reply<O, S> handleDemand(long demand, S state) {
        throw new HandlerException(HandlerException.HandlerViolation.UNSUPPORTED_CALLBACK,
                "handleDemand not implemented by " + getClass().getName());
    }

    /**
     * Called with a batch of events from an upstream subscription.
     *
     * @param events non-empty batch, in upstream order
     * @param from   subscription the batch arrived on
     * @param state  current state
     * @return events to emit (none for a consumer) and the new state
     */
    default Reply<O, S> handleEvents(List<I> events, SubscriptionTag from, S state) {
        throw new HandlerException(HandlerException.HandlerViolation.UNSUPPORTED_CALLBACK,
                "handleEvents not implemented by " + getClass().getName());
    }

    /**
     * Called once a subscription involving this stage is established,
     * on either side of the link.
     */
    default S handleSubscribe(SubscriptionTag tag, boolean asProducer, S state) {
        return state;
    }

    /**
     * Called when a subscription involving this stage ends, on either side
     * of the link. May emit events if the stage is producing.
     */
    default Reply<O, S> handleCancel(SubscriptionTag tag, Reason reason, S state) {
        return Reply.noReply(state);
    }

    /**
     * Called once when the stage terminates. Exceptions are logged and ignored.
     */
    default void terminate(Reason reason, S state) {
    }
}
