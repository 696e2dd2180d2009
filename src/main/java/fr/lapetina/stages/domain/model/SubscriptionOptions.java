package fr.lapetina.stages.domain.model;

import java.util.function.Predicate;

/**
 * Options of a subscription between a downstream and an upstream stage.
 *
 * <p>A null {@code minDemand}, {@code maxDemand} or {@code cancelMode} means the runtime
 * default from configuration applies. Use {@link #withDefaults} to resolve them.
 */
public record SubscriptionOptions(
        Integer minDemand,
        Integer maxDemand,
        CancelMode cancelMode,
        DemandRequest demandRequest,
        String partition,
        Predicate<Object> selector
) {
    public SubscriptionOptions {
        if (demandRequest == null) {
            demandRequest = DemandRequest.AUTOMATIC;
        }
    }

    public static SubscriptionOptions defaults() {
        return builder().build();
    }

    /**
     * Fills unset demand window and cancel mode from the given defaults.
     * When only max demand is set, min demand defaults to 75% of it.
     */
    public SubscriptionOptions withDefaults(int defaultMinDemand, int defaultMaxDemand, CancelMode defaultCancelMode) {
        int max = maxDemand != null ? maxDemand : defaultMaxDemand;
        int min;
        if (minDemand != null) {
            min = minDemand;
        } else if (maxDemand != null) {
            min = max * 3 / 4;
        } else {
            min = defaultMinDemand;
        }
        return new SubscriptionOptions(
                min,
                max,
                cancelMode != null ? cancelMode : defaultCancelMode,
                demandRequest,
                partition,
                selector
        );
    }

    /**
     * Returns true if the window satisfies {@code 0 <= minDemand < maxDemand}.
     * Only meaningful on resolved options.
     */
    public boolean hasValidWindow() {
        return minDemand != null && maxDemand != null
                && minDemand >= 0 && minDemand < maxDemand;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer minDemand;
        private Integer maxDemand;
        private CancelMode cancelMode;
        private DemandRequest demandRequest = DemandRequest.AUTOMATIC;
        private String partition;
        private Predicate<Object> selector;

        public Builder minDemand(int minDemand) {
            this.minDemand = minDemand;
            return this;
        }

        public Builder maxDemand(int maxDemand) {
            this.maxDemand = maxDemand;
            return this;
        }

        public Builder cancelMode(CancelMode cancelMode) {
            this.cancelMode = cancelMode;
            return this;
        }

        public Builder demandRequest(DemandRequest demandRequest) {
            this.demandRequest = demandRequest;
            return this;
        }

        public Builder manual() {
            this.demandRequest = DemandRequest.MANUAL;
            return this;
        }

        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder partition(int partition) {
            this.partition = String.valueOf(partition);
            return this;
        }

        /**
         * Broadcast only: events rejected by the selector are not delivered to this subscriber.
         */
        @SuppressWarnings("unchecked")
        public <E> Builder selector(Predicate<? super E> selector) {
            this.selector = (Predicate<Object>) selector;
            return this;
        }

        public SubscriptionOptions build() {
            return new SubscriptionOptions(minDemand, maxDemand, cancelMode, demandRequest, partition, selector);
        }
    }
}
