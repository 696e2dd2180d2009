package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.Reason;

/**
 * Runtime to stage: terminate with {@code reason}.
 */
public record Stop(Reason reason) implements StageMessage {
}
