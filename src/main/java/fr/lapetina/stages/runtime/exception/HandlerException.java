package fr.lapetina.stages.runtime.exception;

import fr.lapetina.stages.domain.model.ErrorType;

/**
 * Thrown when a stage handler returns a reply that breaks its role's contract.
 * Terminates the owning stage.
 */
public final class HandlerException extends StageException {

    private final HandlerViolation violation;

    public HandlerException(HandlerViolation violation, String details) {
        super(ErrorType.HANDLER_ERROR, "Handler error: " + violation.getMessage() + " - " + details);
        this.violation = violation;
    }

    public HandlerViolation getViolation() {
        return violation;
    }

    public enum HandlerViolation {
        NULL_REPLY("Handler returned null"),
        CONSUMER_EMITTED_EVENTS("Consumer returned output events"),
        DEMAND_EXCEEDED("Producer returned more events than demanded"),
        UNSUPPORTED_CALLBACK("Callback not implemented for this stage");

        private final String message;

        HandlerViolation(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
