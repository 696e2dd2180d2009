package fr.lapetina.stages.domain.model;

/**
 * Role of a stage in the pipeline.
 */
public enum Role {
    /** Emits events in response to downstream demand, never accepts upstream events */
    PRODUCER,

    /** Consumes upstream events and emits transformed events downstream */
    PRODUCER_CONSUMER,

    /** Consumes upstream events, never emits */
    CONSUMER;

    /**
     * Whether stages of this role own a dispatcher and can be subscribed to.
     */
    public boolean isProducing() {
        return this != CONSUMER;
    }

    /**
     * Whether stages of this role can subscribe to an upstream stage.
     */
    public boolean isConsuming() {
        return this != PRODUCER;
    }
}
