package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.DemandMode;

/**
 * Runtime to producing stage: switch between forwarding and accumulating demand.
 */
public record SetDemandMode(DemandMode mode) implements StageMessage {
}
