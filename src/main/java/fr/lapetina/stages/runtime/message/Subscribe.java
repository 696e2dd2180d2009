package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.runtime.StageRef;

import java.util.concurrent.CompletableFuture;

/**
 * Runtime to downstream: start the handshake with {@code upstream}.
 * {@code reply} completes once both ends registered the link.
 */
public record Subscribe(
        SubscriptionTag tag,
        StageRef upstream,
        SubscriptionOptions options,
        CompletableFuture<SubscriptionTag> reply
) implements StageMessage {
}
