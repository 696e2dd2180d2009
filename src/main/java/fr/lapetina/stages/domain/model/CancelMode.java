package fr.lapetina.stages.domain.model;

/**
 * Governs what a downstream stage does when its upstream cancels the
 * subscription or terminates.
 */
public enum CancelMode {
    /** Downstream is notified and stays alive */
    TEMPORARY,

    /** Downstream terminates only when the reason is abnormal */
    TRANSIENT,

    /** Downstream terminates whatever the reason */
    PERMANENT;

    /**
     * Returns true if a stage holding a subscription in this mode must
     * terminate when the subscription ends for the given reason.
     */
    public boolean terminatesOn(Reason reason) {
        return switch (this) {
            case TEMPORARY -> false;
            case TRANSIENT -> reason.isAbnormal();
            case PERMANENT -> true;
        };
    }
}
