package fr.lapetina.stages.runtime.exception;

import fr.lapetina.stages.domain.model.ErrorType;

/**
 * Base class of the runtime's failures. Carries an {@link ErrorType} used for
 * metrics and logging.
 */
public abstract class StageException extends RuntimeException {

    private final ErrorType errorType;

    protected StageException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected StageException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
