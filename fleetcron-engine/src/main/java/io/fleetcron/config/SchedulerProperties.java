package io.fleetcron.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the scheduler.
 */
@ConfigurationProperties(prefix = "fleetcron")
public class SchedulerProperties {
    private boolean enabled = true;
    private String nodeId;
    private Duration tock = Duration.ofSeconds(1); // loop interval
    private int workerPoolSize = 8;
    private Duration jobTimeout = Duration.ofMinutes(30);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Duration peerQueryTimeout = Duration.ofSeconds(2);
    private Duration peerQueryOverallTimeout = Duration.ofSeconds(5);
    private String scheduleFile = "fleetcron/schedule.json";
    private String scheduleSource;
    private String coordinationRoot = "/fleetcron";
    private StoreType store = StoreType.FILE;
    private boolean ensureIndexesOnStartup = false;

    public enum StoreType {
        FILE,
        MONGO
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public Duration getTock() {
        return tock;
    }

    public void setTock(Duration tock) {
        this.tock = tock;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getPeerQueryTimeout() {
        return peerQueryTimeout;
    }

    public void setPeerQueryTimeout(Duration peerQueryTimeout) {
        this.peerQueryTimeout = peerQueryTimeout;
    }

    public Duration getPeerQueryOverallTimeout() {
        return peerQueryOverallTimeout;
    }

    public void setPeerQueryOverallTimeout(Duration peerQueryOverallTimeout) {
        this.peerQueryOverallTimeout = peerQueryOverallTimeout;
    }

    public String getScheduleFile() {
        return scheduleFile;
    }

    public void setScheduleFile(String scheduleFile) {
        this.scheduleFile = scheduleFile;
    }

    /**
     * Optional YAML file with a {@code schedule:} map, loaded at startup.
     */
    public String getScheduleSource() {
        return scheduleSource;
    }

    public void setScheduleSource(String scheduleSource) {
        this.scheduleSource = scheduleSource;
    }

    public String getCoordinationRoot() {
        return coordinationRoot;
    }

    public void setCoordinationRoot(String coordinationRoot) {
        this.coordinationRoot = coordinationRoot;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
