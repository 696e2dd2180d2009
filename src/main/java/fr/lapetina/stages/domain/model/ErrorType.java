package fr.lapetina.stages.domain.model;

/**
 * Error taxonomy for the pipeline runtime.
 * Used for exception classification and metrics tagging.
 */
public enum ErrorType {
    /** Subscription rejected (bad demand window, topology violation, timeout) */
    SUBSCRIBE_ERROR,

    /** Event could not be routed by the dispatcher */
    DISPATCH_ERROR,

    /** User handler threw or returned an invalid reply */
    HANDLER_ERROR,

    /** Internal runtime error */
    INTERNAL_ERROR
}
