package fr.lapetina.stages.domain.model;

import java.util.Objects;

/**
 * Why a stage terminated or a subscription was cancelled.
 * Immutable and thread-safe.
 */
public record Reason(Kind kind, String message, Throwable cause) {

    public Reason {
        Objects.requireNonNull(kind, "Kind is required");
        if (message == null) {
            message = cause != null ? String.valueOf(cause.getMessage()) : kind.name().toLowerCase();
        }
    }

    public enum Kind {
        /** Regular completion or an explicit cancel */
        NORMAL,

        /** Runtime is shutting down */
        SHUTDOWN,

        /** Handler failure, dispatch failure or propagated fault */
        ABNORMAL
    }

    public static Reason normal() {
        return new Reason(Kind.NORMAL, null, null);
    }

    public static Reason normal(String message) {
        return new Reason(Kind.NORMAL, message, null);
    }

    public static Reason shutdown() {
        return new Reason(Kind.SHUTDOWN, null, null);
    }

    public static Reason abnormal(String message) {
        return new Reason(Kind.ABNORMAL, message, null);
    }

    public static Reason abnormal(Throwable cause) {
        return new Reason(Kind.ABNORMAL, null, cause);
    }

    public boolean isAbnormal() {
        return kind == Kind.ABNORMAL;
    }

    @Override
    public String toString() {
        return kind + "(" + message + ")";
    }
}
