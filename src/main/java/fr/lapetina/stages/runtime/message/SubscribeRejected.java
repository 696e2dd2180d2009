package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.exception.SubscribeException;

/**
 * Upstream to downstream: the subscription was refused.
 */
public record SubscribeRejected(SubscriptionTag tag, SubscribeException error) implements StageMessage {
}
