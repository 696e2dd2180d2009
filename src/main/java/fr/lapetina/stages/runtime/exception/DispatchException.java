package fr.lapetina.stages.runtime.exception;

import fr.lapetina.stages.domain.model.ErrorType;

/**
 * Thrown by a dispatcher when produced events cannot be routed.
 * The batch is rejected as a whole, nothing is delivered.
 */
public final class DispatchException extends StageException {

    private final DispatchFailure failure;
    private final String partition;

    public DispatchException(DispatchFailure failure, String partition) {
        super(ErrorType.DISPATCH_ERROR, "Dispatch failed: " + failure.getMessage() + " - partition=" + partition);
        this.failure = failure;
        this.partition = partition;
    }

    public DispatchFailure getFailure() {
        return failure;
    }

    public String getPartition() {
        return partition;
    }

    public enum DispatchFailure {
        UNKNOWN_PARTITION("Event hashed to a partition that is not configured"),
        UNBOUND_PARTITION("Event hashed to a partition with no active subscription");

        private final String message;

        DispatchFailure(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
