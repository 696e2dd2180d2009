package fr.lapetina.stages.runtime.exception;

import fr.lapetina.stages.domain.model.ErrorType;

/**
 * Thrown when a subscription cannot be established.
 *
 * This occurs when:
 * - The demand window is invalid
 * - The upstream stage cannot be subscribed to, or the downstream cannot subscribe
 * - The dispatcher refuses the subscription (partition unknown or taken, limit reached)
 * - The handshake did not complete in time
 */
public final class SubscribeException extends StageException {

    private final SubscribeRejection rejection;

    public SubscribeException(SubscribeRejection rejection) {
        super(ErrorType.SUBSCRIBE_ERROR, "Subscribe rejected: " + rejection.getMessage());
        this.rejection = rejection;
    }

    public SubscribeException(SubscribeRejection rejection, String details) {
        super(ErrorType.SUBSCRIBE_ERROR, "Subscribe rejected: " + rejection.getMessage() + " - " + details);
        this.rejection = rejection;
    }

    public SubscribeException(SubscribeRejection rejection, String details, Throwable cause) {
        super(ErrorType.SUBSCRIBE_ERROR, "Subscribe rejected: " + rejection.getMessage() + " - " + details, cause);
        this.rejection = rejection;
    }

    public SubscribeRejection getRejection() {
        return rejection;
    }

    public enum SubscribeRejection {
        INVALID_DEMAND_WINDOW("Demand window must satisfy 0 <= min < max"),
        NOT_A_PRODUCER("Upstream stage has no dispatcher"),
        NOT_A_CONSUMER("Downstream stage cannot consume events"),
        STAGE_NOT_ALIVE("Stage is not alive"),
        MISSING_PARTITION("Partition dispatcher requires a partition option"),
        UNKNOWN_PARTITION("Partition is not configured on the dispatcher"),
        PARTITION_ALREADY_BOUND("Partition already has an active subscription"),
        TOO_MANY_SUBSCRIBERS("Dispatcher subscriber limit reached"),
        TIMEOUT("Subscribe handshake timed out"),
        INTERRUPTED("Interrupted while waiting for the subscribe handshake");

        private final String message;

        SubscribeRejection(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
