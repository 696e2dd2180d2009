package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionTag;

/**
 * Runtime to stage: cancel {@code tag}, whichever end of it this stage is.
 */
public record CancelRequest(SubscriptionTag tag, Reason reason) implements StageMessage {
}
