package io.fleetcron.internal.event;

import io.fleetcron.core.JobResult;
import io.fleetcron.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: writes every returned job result to the log.
 */
public class LoggingEventSink implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void publish(JobResult result) {
        if (result.success()) {
            log.info("Job returned job={} jid={} function={} retcode={} duration={} return={}",
                    result.jobName(), result.jid(), result.function(), result.retcode(), result.duration(), result.returnValue());
        } else {
            log.warn("Job returned job={} jid={} function={} retcode={} duration={} error={}",
                    result.jobName(), result.jid(), result.function(), result.retcode(), result.duration(), result.error());
        }
    }
}
