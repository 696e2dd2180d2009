package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionTag;

/**
 * Runtime to downstream: ask upstream for {@code count} events on a manual subscription.
 */
public record ManualAsk(SubscriptionTag tag, long count) implements StageMessage {
}
