package fr.lapetina.stages.domain.dispatcher;

import fr.lapetina.stages.domain.model.SubscriptionTag;

import java.util.List;

/**
 * Downstream end of a subscription as seen by a dispatcher.
 *
 * Delivery is asynchronous: the batch is handed to the subscriber's mailbox
 * and the call returns immediately.
 */
public interface SubscriberChannel<E> {

    SubscriptionTag tag();

    void deliver(List<E> events);
}
