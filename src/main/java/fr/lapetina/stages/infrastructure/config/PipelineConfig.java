package fr.lapetina.stages.infrastructure.config;

/**
 * Root configuration object for the stage runtime.
 * Designed to be populated from YAML.
 */
public class PipelineConfig {

    private ServerConfig server = new ServerConfig();
    private MailboxConfig mailbox = new MailboxConfig();
    private SubscriptionConfig subscription = new SubscriptionConfig();
    private StageConfig stage = new StageConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private DemoConfig demo = new DemoConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public MailboxConfig getMailbox() { return mailbox; }
    public void setMailbox(MailboxConfig mailbox) { this.mailbox = mailbox; }

    public SubscriptionConfig getSubscription() { return subscription; }
    public void setSubscription(SubscriptionConfig subscription) { this.subscription = subscription; }

    public StageConfig getStage() { return stage; }
    public void setStage(StageConfig stage) { this.stage = stage; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public DemoConfig getDemo() { return demo; }
    public void setDemo(DemoConfig demo) { this.demo = demo; }

    /**
     * Admin HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 8080;
        private int backlog = 100;
        private int threads = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Per-stage mailbox (Disruptor ring buffer) configuration.
     */
    public static class MailboxConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Defaults applied to subscriptions that do not set their own window.
     */
    public static class SubscriptionConfig {
        private int minDemand = 750;
        private int maxDemand = 1000;
        private String cancelMode = "permanent";
        private long subscribeTimeoutMs = 5000;

        public int getMinDemand() { return minDemand; }
        public void setMinDemand(int minDemand) { this.minDemand = minDemand; }

        public int getMaxDemand() { return maxDemand; }
        public void setMaxDemand(int maxDemand) { this.maxDemand = maxDemand; }

        public String getCancelMode() { return cancelMode; }
        public void setCancelMode(String cancelMode) { this.cancelMode = cancelMode; }

        public long getSubscribeTimeoutMs() { return subscribeTimeoutMs; }
        public void setSubscribeTimeoutMs(long subscribeTimeoutMs) { this.subscribeTimeoutMs = subscribeTimeoutMs; }
    }

    /**
     * Stage lifecycle settings.
     */
    public static class StageConfig {
        private int bufferWarningThreshold = 10_000;
        private long inspectTimeoutMs = 2000;
        private long shutdownTimeoutMs = 10_000;

        public int getBufferWarningThreshold() { return bufferWarningThreshold; }
        public void setBufferWarningThreshold(int bufferWarningThreshold) { this.bufferWarningThreshold = bufferWarningThreshold; }

        public long getInspectTimeoutMs() { return inspectTimeoutMs; }
        public void setInspectTimeoutMs(long inspectTimeoutMs) { this.inspectTimeoutMs = inspectTimeoutMs; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "stages";
        private boolean jvmMetrics = true;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }
    }

    /**
     * Sample pipeline started by the application: a counter producer feeding
     * a doubling stage feeding logging consumers.
     */
    public static class DemoConfig {
        private boolean enabled = true;
        private String dispatcher = "demand";
        private int consumers = 2;
        private long eventCount = 10_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getDispatcher() { return dispatcher; }
        public void setDispatcher(String dispatcher) { this.dispatcher = dispatcher; }

        public int getConsumers() { return consumers; }
        public void setConsumers(int consumers) { this.consumers = consumers; }

        public long getEventCount() { return eventCount; }
        public void setEventCount(long eventCount) { this.eventCount = eventCount; }
    }
}
