package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.StageRef;

/**
 * Downstream to upstream: register {@code downstream} with the dispatcher.
 */
public record SubscribeUpstream(
        SubscriptionTag tag,
        StageRef downstream,
        SubscriptionOptions options
) implements StageMessage {
}
