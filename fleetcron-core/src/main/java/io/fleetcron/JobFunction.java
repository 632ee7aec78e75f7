package io.fleetcron;

import io.fleetcron.core.JobContext;

import java.util.List;
import java.util.Map;

/**
 * A named action a scheduled job can invoke. Implementations are registered once at startup
 * and looked up by {@link #name()}.
 */
public interface JobFunction {
    String name();

    Object invoke(List<Object> args, Map<String, Object> kwargs, JobContext context) throws Exception;
}
