package io.fleetcron.internal.coordination;

import io.fleetcron.core.CoordinationUnavailableException;
import io.fleetcron.core.SemaphoreLease;
import io.fleetcron.spi.CoordinationClient;
import io.fleetcron.spi.SessionListener;
import io.fleetcron.spi.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Fleet-wide counting semaphores and minimum-party barriers on top of a {@link CoordinationClient}.
 *
 * <p>A lock request is an ephemeral sequential node under {@code <root>/semaphores/<resource>}
 * whose data is the caller's identifier. The request holds a slot while its node is among the
 * {@code maxConcurrent} lowest sequence numbers, so slots are granted in arrival order. Waiting
 * callers block on child watches, never on a sleep loop.
 *
 * <p>Lost sessions are fatal for leases: every held lease turns {@code LOST} and the caller must
 * lock again. Service errors never escape; {@code lock} and {@code minParty} fail closed.
 */
public class ConcurrencyCoordinator implements SessionListener {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyCoordinator.class);
    private static final String NODE_PREFIX = "lease-";

    private final CoordinationClient client;
    private final String root;
    private final Clock clock;

    private final Map<LeaseKey, SemaphoreLease> leases = new ConcurrentHashMap<>();
    private final Map<LeaseKey, String> partyNodes = new ConcurrentHashMap<>();

    private record LeaseKey(String resource, String identifier) {
    }

    public ConcurrencyCoordinator(CoordinationClient client, String root, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.root = normalizeRoot(root);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        client.addSessionListener(this);
    }

    /**
     * Tries to take one of {@code maxConcurrent} slots of {@code resource}.
     *
     * @param blocking wait for a slot instead of giving up at once
     * @param timeout  bound for a blocking wait; required and positive when {@code blocking}
     * @return true when the slot is held
     */
    public boolean lock(String resource, String identifier, int maxConcurrent, boolean blocking, Duration timeout) {
        requireName(resource, "resource");
        requireName(identifier, "identifier");
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        requireWaitBound(blocking, timeout);
        LeaseKey key = new LeaseKey(resource, identifier);
        SemaphoreLease held = leases.get(key);
        if (held != null && held.isGranted()) {
            return true;
        }

        String parent = semaphorePath(resource);
        String nodePath;
        try {
            nodePath = client.createEphemeralSequential(parent, NODE_PREFIX, identifier.getBytes(StandardCharsets.UTF_8));
        } catch (CoordinationUnavailableException ex) {
            log.warn("Coordination service unavailable, lock denied resource={} identifier={} msg={}", resource, identifier, ex.getMessage());
            return false;
        }
        SemaphoreLease lease = new SemaphoreLease(resource, identifier, nodePath, sequenceOf(nodePath));
        Instant deadline = blocking ? clock.instant().plus(timeout) : null;

        try {
            while (true) {
                CountDownLatch changed = new CountDownLatch(1);
                if (blocking) {
                    // watch before reading so a change between the two is not missed
                    client.watchChildren(parent, changed::countDown);
                }
                List<String> children = client.getChildren(parent);
                int position = children.indexOf(nameOf(nodePath));
                if (position < 0) {
                    lease.lose();
                    log.warn("Lock request node vanished resource={} identifier={}", resource, identifier);
                    return false;
                }
                if (position < maxConcurrent) {
                    lease.grant(clock.instant());
                    leases.put(key, lease);
                    log.debug("Lock granted resource={} identifier={} seq={}", resource, identifier, lease.sequenceNumber());
                    return true;
                }
                if (!blocking) {
                    abandon(nodePath);
                    log.debug("Lock busy resource={} identifier={} position={} max={}", resource, identifier, position, maxConcurrent);
                    return false;
                }
                if (!await(changed, deadline)) {
                    abandon(nodePath);
                    log.info("Lock wait timed out resource={} identifier={} timeout={}", resource, identifier, timeout);
                    return false;
                }
            }
        } catch (CoordinationUnavailableException ex) {
            lease.lose();
            abandon(nodePath);
            log.warn("Coordination service unavailable while locking resource={} identifier={} msg={}", resource, identifier, ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandon(nodePath);
            return false;
        }
    }

    /**
     * Releases the slot held by {@code identifier}. Releasing a slot that is not held succeeds.
     *
     * @return false only when the coordination service could not be reached
     */
    public boolean unlock(String resource, String identifier) {
        SemaphoreLease lease = leases.remove(new LeaseKey(resource, identifier));
        if (lease == null) {
            return true;
        }
        try {
            client.delete(lease.nodePath());
            lease.release();
            log.debug("Lock released resource={} identifier={}", resource, identifier);
            return true;
        } catch (CoordinationUnavailableException ex) {
            lease.lose();
            log.warn("Coordination service unavailable, could not release resource={} identifier={} msg={}", resource, identifier, ex.getMessage());
            return false;
        }
    }

    public boolean isHeld(String resource, String identifier) {
        SemaphoreLease lease = leases.get(new LeaseKey(resource, identifier));
        return lease != null && lease.isGranted();
    }

    public Optional<SemaphoreLease> lease(String resource, String identifier) {
        return Optional.ofNullable(leases.get(new LeaseKey(resource, identifier)));
    }

    /**
     * Registers {@code identifier} as a party member of {@code resource} and checks whether at least
     * {@code minNodes} distinct members are present. Membership stays registered after the call,
     * whatever its outcome, until {@link #leaveParty(String, String)}.
     */
    public boolean minParty(String resource, String identifier, int minNodes, boolean blocking, Duration timeout) {
        requireName(resource, "resource");
        requireName(identifier, "identifier");
        if (minNodes < 1) {
            throw new IllegalArgumentException("minNodes must be >= 1");
        }
        requireWaitBound(blocking, timeout);
        LeaseKey key = new LeaseKey(resource, identifier);
        String parent = partyPath(resource);
        Instant deadline = blocking ? clock.instant().plus(timeout) : null;
        try {
            String existing = partyNodes.get(key);
            if (existing == null || !client.exists(existing)) {
                partyNodes.put(key, client.createEphemeralSequential(parent, NODE_PREFIX, identifier.getBytes(StandardCharsets.UTF_8)));
            }
            while (true) {
                CountDownLatch changed = new CountDownLatch(1);
                if (blocking) {
                    client.watchChildren(parent, changed::countDown);
                }
                int members = distinctMembers(parent);
                if (members >= minNodes) {
                    log.debug("Party reached resource={} members={} min={}", resource, members, minNodes);
                    return true;
                }
                if (!blocking || !await(changed, deadline)) {
                    log.debug("Party not reached resource={} members={} min={}", resource, members, minNodes);
                    return false;
                }
            }
        } catch (CoordinationUnavailableException ex) {
            log.warn("Coordination service unavailable, party check failed resource={} msg={}", resource, ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean leaveParty(String resource, String identifier) {
        String node = partyNodes.remove(new LeaseKey(resource, identifier));
        if (node == null) {
            return true;
        }
        try {
            client.delete(node);
            return true;
        } catch (CoordinationUnavailableException ex) {
            log.warn("Coordination service unavailable, could not leave party resource={} msg={}", resource, ex.getMessage());
            return false;
        }
    }

    /**
     * Releases every lease and party membership held through this coordinator.
     */
    public void releaseAll() {
        int leaseCount = leases.size();
        for (LeaseKey key : Set.copyOf(leases.keySet())) {
            unlock(key.resource(), key.identifier());
        }
        for (LeaseKey key : Set.copyOf(partyNodes.keySet())) {
            leaveParty(key.resource(), key.identifier());
        }
        if (leaseCount > 0) {
            log.info("Released leases count={}", leaseCount);
        }
    }

    @Override
    public void stateChanged(SessionState state) {
        switch (state) {
            case LOST -> {
                int lost = 0;
                for (SemaphoreLease lease : leases.values()) {
                    if (lease.lose()) {
                        lost++;
                    }
                }
                leases.clear();
                partyNodes.clear();
                log.warn("Coordination session lost, leases marked lost count={}", lost);
            }
            case SUSPENDED -> log.warn("Coordination session suspended, held leases={}", leases.size());
            case RECONNECTED -> verifyLeases();
            case CONNECTED -> log.debug("Coordination session connected");
        }
    }

    private void verifyLeases() {
        for (Map.Entry<LeaseKey, SemaphoreLease> e : leases.entrySet()) {
            SemaphoreLease lease = e.getValue();
            try {
                if (!client.exists(lease.nodePath())) {
                    lease.lose();
                    leases.remove(e.getKey(), lease);
                    log.warn("Lease lost during reconnect resource={} identifier={}", lease.resourceName(), lease.identifier());
                }
            } catch (CoordinationUnavailableException ex) {
                log.warn("Could not verify lease resource={} msg={}", lease.resourceName(), ex.getMessage());
            }
        }
    }

    private int distinctMembers(String parent) {
        Set<String> ids = new HashSet<>();
        for (String child : client.getChildren(parent)) {
            byte[] data = client.getData(parent + "/" + child);
            if (data != null) {
                ids.add(new String(data, StandardCharsets.UTF_8));
            }
        }
        return ids.size();
    }

    private static void requireWaitBound(boolean blocking, Duration timeout) {
        if (blocking && (timeout == null || timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("a blocking wait needs a positive timeout, got: " + timeout);
        }
    }

    private boolean await(CountDownLatch latch, Instant deadline) throws InterruptedException {
        long remaining = Duration.between(clock.instant(), deadline).toMillis();
        if (remaining <= 0) {
            return false;
        }
        return latch.await(remaining, TimeUnit.MILLISECONDS);
    }

    private void abandon(String nodePath) {
        try {
            client.delete(nodePath);
        } catch (CoordinationUnavailableException ex) {
            log.debug("Could not delete abandoned node path={} msg={}", nodePath, ex.getMessage());
        }
    }

    private String semaphorePath(String resource) {
        return root + "/semaphores/" + resource;
    }

    private String partyPath(String resource) {
        return root + "/parties/" + resource;
    }

    private static String nameOf(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static long sequenceOf(String path) {
        String name = nameOf(path);
        String digits = name.startsWith(NODE_PREFIX) ? name.substring(NODE_PREFIX.length()) : name;
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        if ("resource".equals(what) && value.contains("/")) {
            throw new IllegalArgumentException("resource must not contain '/'");
        }
    }

    private static String normalizeRoot(String root) {
        String r = root == null || root.isBlank() ? "/fleetcron" : root.trim();
        if (!r.startsWith("/")) {
            r = "/" + r;
        }
        return r.endsWith("/") && r.length() > 1 ? r.substring(0, r.length() - 1) : r;
    }
}
