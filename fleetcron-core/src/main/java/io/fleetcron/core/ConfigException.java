package io.fleetcron.core;

/**
 * A job definition is malformed. Raised at add/modify/reload time; the offending
 * definition is rejected as a whole and never partially applied.
 */
public class ConfigException extends FleetcronException {

    private final String jobName;

    public ConfigException(String jobName, String message) {
        super(jobName == null ? message : "job " + jobName + ": " + message);
        this.jobName = jobName;
    }

    public ConfigException(String jobName, String message, Throwable cause) {
        super(jobName == null ? message : "job " + jobName + ": " + message, cause);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
