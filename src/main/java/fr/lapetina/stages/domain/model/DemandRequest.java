package fr.lapetina.stages.domain.model;

/**
 * Whether a subscription refills its demand by itself.
 */
public enum DemandRequest {
    /** Asks max demand on subscribe and refills at the low-water mark */
    AUTOMATIC,

    /** Demand is only sent when the application calls ask */
    MANUAL
}
