package fr.lapetina.stages.runtime;

import fr.lapetina.stages.domain.model.CancelMode;
import fr.lapetina.stages.domain.model.DemandRequest;
import fr.lapetina.stages.domain.model.SubscriptionTag;

import java.util.Objects;

/**
 * Downstream-side accounting of one subscription.
 *
 * {@code outstanding} counts events asked from upstream and not received yet,
 * {@code buffered} counts events received but not yet handled. Their sum never
 * exceeds {@code maxDemand}: once it falls to {@code minDemand} or below after
 * events are handled, an automatic subscription asks for exactly what brings
 * it back to {@code maxDemand}.
 *
 * Not thread-safe, owned by the downstream stage.
 */
public final class ConsumerSubscription {

    private final SubscriptionTag tag;
    private final StageRef upstream;
    private final int minDemand;
    private final int maxDemand;
    private final CancelMode cancelMode;
    private final DemandRequest demandRequest;

    private long outstanding;
    private long buffered;

    public ConsumerSubscription(
            SubscriptionTag tag,
            StageRef upstream,
            int minDemand,
            int maxDemand,
            CancelMode cancelMode,
            DemandRequest demandRequest
    ) {
        if (minDemand < 0 || minDemand >= maxDemand) {
            throw new IllegalArgumentException("Demand window must satisfy 0 <= min < max: min="
                    + minDemand + ", max=" + maxDemand);
        }
        this.tag = Objects.requireNonNull(tag, "Tag is required");
        this.upstream = upstream;
        this.minDemand = minDemand;
        this.maxDemand = maxDemand;
        this.cancelMode = Objects.requireNonNull(cancelMode, "Cancel mode is required");
        this.demandRequest = Objects.requireNonNull(demandRequest, "Demand request is required");
    }

    /**
     * Demand sent right after subscribing: the full window.
     */
    public long initialAsk() {
        long ask = maxDemand - level();
        outstanding += ask;
        return ask;
    }

    /**
     * Accounts for a batch arriving from upstream.
     *
     * @throws IllegalStateException if upstream sent more than it was asked for
     */
    public void onEventsReceived(int count) {
        if (count > outstanding) {
            throw new IllegalStateException("Upstream sent more events than demanded: tag=" + tag
                    + ", received=" + count + ", outstanding=" + outstanding);
        }
        outstanding -= count;
        buffered += count;
    }

    /**
     * Accounts for events handed to the handler.
     *
     * @return demand to ask upstream now, 0 if none
     */
    public long onEventsProcessed(int count) {
        buffered = Math.max(0, buffered - count);
        if (demandRequest == DemandRequest.MANUAL) {
            return 0;
        }
        long level = level();
        if (level > minDemand) {
            return 0;
        }
        long ask = maxDemand - level;
        outstanding += ask;
        return ask;
    }

    /**
     * Grants an application-driven ask, clamped so the window is never exceeded.
     *
     * @return demand actually granted, possibly 0
     */
    public long manualAsk(long count) {
        long grant = Math.max(0, Math.min(count, maxDemand - level()));
        outstanding += grant;
        return grant;
    }

    private long level() {
        return outstanding + buffered;
    }

    public SubscriptionTag tag() {
        return tag;
    }

    public StageRef upstream() {
        return upstream;
    }

    public int minDemand() {
        return minDemand;
    }

    public int maxDemand() {
        return maxDemand;
    }

    public CancelMode cancelMode() {
        return cancelMode;
    }

    public DemandRequest demandRequest() {
        return demandRequest;
    }

    public long outstanding() {
        return outstanding;
    }

    public long buffered() {
        return buffered;
    }

    @Override
    public String toString() {
        return "ConsumerSubscription{tag=" + tag +
                ", upstream=" + upstream +
                ", window=" + minDemand + "/" + maxDemand +
                ", outstanding=" + outstanding +
                ", buffered=" + buffered +
                ", cancelMode=" + cancelMode +
                '}';
    }
}
