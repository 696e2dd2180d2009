package fr.lapetina.stages.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.stages.runtime.StageRef;
import fr.lapetina.stages.runtime.StageSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Admin API view of a stage.
 *
 * The list endpoint only fills identity fields; the detail endpoint adds
 * the accounting reported by the stage itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageResponse {

    private String id;
    private String name;
    private String role;
    private boolean alive;

    @JsonProperty("demand_mode")
    private String demandMode;

    @JsonProperty("pending_demand")
    private Long pendingDemand;

    @JsonProperty("buffered_events")
    private Long bufferedEvents;

    @JsonProperty("inbound_events")
    private Long inboundEvents;

    private String dispatcher;

    @JsonProperty("dispatcher_demand")
    private Map<String, Long> dispatcherDemand;

    private List<SubscriptionResponse> subscriptions;

    @JsonProperty("inspected_at")
    private Instant inspectedAt;

    public static StageResponse fromRef(StageRef ref) {
        StageResponse response = new StageResponse();
        response.id = ref.getId();
        response.name = ref.getName();
        response.role = ref.getRole().name();
        response.alive = ref.isAlive();
        return response;
    }

    public static StageResponse fromSnapshot(StageSnapshot snapshot) {
        StageResponse response = new StageResponse();
        response.id = snapshot.id();
        response.name = snapshot.name();
        response.role = snapshot.role().name();
        response.alive = snapshot.alive();
        response.demandMode = snapshot.demandMode().name();
        response.pendingDemand = snapshot.pendingDemand();
        response.bufferedEvents = (long) snapshot.bufferedEvents();
        response.inboundEvents = snapshot.inboundEvents();
        response.dispatcher = snapshot.dispatcher();
        response.dispatcherDemand = snapshot.dispatcherDemand();
        response.inspectedAt = Instant.now();

        List<SubscriptionResponse> subscriptions = new ArrayList<>();
        for (StageSnapshot.SubscriptionSnapshot subscription : snapshot.subscriptions()) {
            subscriptions.add(SubscriptionResponse.fromSnapshot(subscription));
        }
        response.subscriptions = subscriptions;
        return response;
    }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public boolean isAlive() { return alive; }
    public void setAlive(boolean alive) { this.alive = alive; }

    public String getDemandMode() { return demandMode; }
    public void setDemandMode(String demandMode) { this.demandMode = demandMode; }

    public Long getPendingDemand() { return pendingDemand; }
    public void setPendingDemand(Long pendingDemand) { this.pendingDemand = pendingDemand; }

    public Long getBufferedEvents() { return bufferedEvents; }
    public void setBufferedEvents(Long bufferedEvents) { this.bufferedEvents = bufferedEvents; }

    public Long getInboundEvents() { return inboundEvents; }
    public void setInboundEvents(Long inboundEvents) { this.inboundEvents = inboundEvents; }

    public String getDispatcher() { return dispatcher; }
    public void setDispatcher(String dispatcher) { this.dispatcher = dispatcher; }

    public Map<String, Long> getDispatcherDemand() { return dispatcherDemand; }
    public void setDispatcherDemand(Map<String, Long> dispatcherDemand) { this.dispatcherDemand = dispatcherDemand; }

    public List<SubscriptionResponse> getSubscriptions() { return subscriptions; }
    public void setSubscriptions(List<SubscriptionResponse> subscriptions) { this.subscriptions = subscriptions; }

    public Instant getInspectedAt() { return inspectedAt; }
    public void setInspectedAt(Instant inspectedAt) { this.inspectedAt = inspectedAt; }

    /**
     * Consumer-side view of one upstream subscription.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SubscriptionResponse {

        private String tag;

        @JsonProperty("upstream_id")
        private String upstreamId;

        @JsonProperty("min_demand")
        private int minDemand;

        @JsonProperty("max_demand")
        private int maxDemand;

        @JsonProperty("outstanding_demand")
        private long outstandingDemand;

        @JsonProperty("buffered_events")
        private long bufferedEvents;

        @JsonProperty("cancel_mode")
        private String cancelMode;

        @JsonProperty("demand_request")
        private String demandRequest;

        static SubscriptionResponse fromSnapshot(StageSnapshot.SubscriptionSnapshot snapshot) {
            SubscriptionResponse response = new SubscriptionResponse();
            response.tag = snapshot.tag();
            response.upstreamId = snapshot.upstreamId();
            response.minDemand = snapshot.minDemand();
            response.maxDemand = snapshot.maxDemand();
            response.outstandingDemand = snapshot.outstandingDemand();
            response.bufferedEvents = snapshot.bufferedEvents();
            response.cancelMode = snapshot.cancelMode().name();
            response.demandRequest = snapshot.demandRequest().name();
            return response;
        }

        public String getTag() { return tag; }
        public void setTag(String tag) { this.tag = tag; }

        public String getUpstreamId() { return upstreamId; }
        public void setUpstreamId(String upstreamId) { this.upstreamId = upstreamId; }

        public int getMinDemand() { return minDemand; }
        public void setMinDemand(int minDemand) { this.minDemand = minDemand; }

        public int getMaxDemand() { return maxDemand; }
        public void setMaxDemand(int maxDemand) { this.maxDemand = maxDemand; }

        public long getOutstandingDemand() { return outstandingDemand; }
        public void setOutstandingDemand(long outstandingDemand) { this.outstandingDemand = outstandingDemand; }

        public long getBufferedEvents() { return bufferedEvents; }
        public void setBufferedEvents(long bufferedEvents) { this.bufferedEvents = bufferedEvents; }

        public String getCancelMode() { return cancelMode; }
        public void setCancelMode(String cancelMode) { this.cancelMode = cancelMode; }

        public String getDemandRequest() { return demandRequest; }
        public void setDemandRequest(String demandRequest) { this.demandRequest = demandRequest; }
    }
}
