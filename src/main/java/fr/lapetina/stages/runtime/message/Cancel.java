package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionTag;

/**
 * Peer to peer: the other end of {@code tag} cancelled it or terminated.
 */
public record Cancel(SubscriptionTag tag, Reason reason) implements StageMessage {
}
