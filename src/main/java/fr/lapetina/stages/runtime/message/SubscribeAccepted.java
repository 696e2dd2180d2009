package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.StageRef;

/**
 * Upstream to downstream: the dispatcher registered the subscription.
 */
public record SubscribeAccepted(SubscriptionTag tag, StageRef upstream) implements StageMessage {
}
