package fr.lapetina.stages.domain.dispatcher;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.exception.DispatchException;
import fr.lapetina.stages.runtime.exception.SubscribeException;

import java.util.List;
import java.util.Map;

/**
 * Routes events produced by a stage to its subscribers according to their
 * outstanding demand.
 *
 * A dispatcher is owned by exactly one stage and only ever called from that
 * stage's thread, so implementations are not thread-safe. It is the only
 * place where upstream-side demand counters are mutated.
 *
 * The {@code long} returned by {@link #subscribe}, {@link #ask} and
 * {@link #cancel} is the demand the owning stage may now pass on to its
 * producer handler. {@link #cancel} may return a negative value: demand
 * already passed on for the removed subscriber and no longer wanted.
 */
public interface Dispatcher<E> {

    /**
     * Returns the name of this dispatcher for logs and metrics.
     */
    String getName();

    /**
     * Registers a new subscriber, with no demand yet.
     *
     * @throws SubscribeException if the subscription breaks the dispatcher's topology
     */
    long subscribe(SubscriberChannel<E> channel, SubscriptionOptions options);

    /**
     * Removes a subscriber. Unknown tags are ignored.
     *
     * @return demand to add, negative when the subscriber's unserved demand is withdrawn
     */
    long cancel(SubscriptionTag tag);

    /**
     * Adds {@code counter} to the outstanding demand of a subscriber. Unknown tags are ignored.
     */
    long ask(SubscriptionTag tag, long counter);

    /**
     * Delivers as many events as current demand allows.
     *
     * @param events events in production order
     * @return events that could not be delivered, in order, to be kept by the stage
     * @throws DispatchException if an event cannot be routed; nothing is delivered then
     */
    List<E> dispatch(List<E> events);

    /**
     * Outstanding demand per subscriber, in subscription order.
     */
    Map<SubscriptionTag, Long> outstandingDemand();

    int subscriberCount();

    /**
     * Number of events held inside the dispatcher waiting for demand.
     */
    default int queuedEvents() {
        return 0;
    }
}
