package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionTag;

/**
 * Downstream to upstream: {@code count} more events may be sent on {@code tag}.
 */
public record Ask(SubscriptionTag tag, long count) implements StageMessage {
}
