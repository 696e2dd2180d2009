package fr.lapetina.stages.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies one subscription among possibly many between the same pair of stages.
 */
public record SubscriptionTag(String value) {

    public SubscriptionTag {
        Objects.requireNonNull(value, "Tag value is required");
    }

    public static SubscriptionTag random() {
        return new SubscriptionTag(UUID.randomUUID().toString());
    }

    public static SubscriptionTag of(String value) {
        return new SubscriptionTag(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
