package fr.lapetina.stages.domain.model;

/**
 * How a producing stage treats incoming demand.
 */
public enum DemandMode {
    /** Demand is forwarded to the handler as soon as it arrives */
    FORWARD,

    /** Demand is accumulated and only forwarded once the stage is switched back */
    ACCUMULATE
}
