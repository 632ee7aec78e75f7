package io.fleetcron.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Resolves the identity this process uses in running-job records and coordination nodes.
 */
public final class NodeIds {
    private static final Logger log = LoggerFactory.getLogger(NodeIds.class);

    private NodeIds() {
    }

    /**
     * Returns {@code configured} when set, otherwise {@code host-pid-uuid} capped at 128 characters.
     */
    public static String resolve(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }

        String host = "fleetcron";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            log.debug("Could not resolve local host name, using default msg={}", ex.getMessage());
        }

        String generated = host + "-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
