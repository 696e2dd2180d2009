package fr.lapetina.stages.runtime;

import fr.lapetina.stages.domain.model.CancelMode;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.DemandRequest;
import fr.lapetina.stages.domain.model.Role;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a stage's accounting, taken on the stage's own thread.
 *
 * @param pendingDemand    demand granted by the dispatcher and not yet produced
 * @param bufferedEvents   produced events waiting for demand, in the stage or its dispatcher
 * @param inboundEvents    upstream events received but not yet handled
 * @param dispatcherDemand outstanding demand per downstream subscription, by tag
 * @param subscriptions    upstream subscriptions of this stage
 */
public record StageSnapshot(
        String id,
        String name,
        Role role,
        boolean alive,
        DemandMode demandMode,
        long pendingDemand,
        int bufferedEvents,
        long inboundEvents,
        String dispatcher,
        Map<String, Long> dispatcherDemand,
        List<SubscriptionSnapshot> subscriptions
) {
    public StageSnapshot {
        dispatcherDemand = dispatcherDemand != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dispatcherDemand))
                : Map.of();
        subscriptions = subscriptions != null ? List.copyOf(subscriptions) : List.of();
    }

    public record SubscriptionSnapshot(
            String tag,
            String upstreamId,
            int minDemand,
            int maxDemand,
            long outstandingDemand,
            long bufferedEvents,
            CancelMode cancelMode,
            DemandRequest demandRequest
    ) {
        static SubscriptionSnapshot of(ConsumerSubscription subscription) {
            return new SubscriptionSnapshot(
                    subscription.tag().value(),
                    subscription.upstream() != null ? subscription.upstream().getId() : null,
                    subscription.minDemand(),
                    subscription.maxDemand(),
                    subscription.outstanding(),
                    subscription.buffered(),
                    subscription.cancelMode(),
                    subscription.demandRequest()
            );
        }
    }
}
