package io.fleetcron.spi;

import io.fleetcron.core.JobContext;

import java.util.List;
import java.util.Map;

/**
 * Black-box call into the action catalog. The scheduler bounds every call with a timeout.
 */
public interface ActionInvoker {

    Object invoke(String functionId, List<Object> args, Map<String, Object> kwargs, JobContext context) throws Exception;
}
