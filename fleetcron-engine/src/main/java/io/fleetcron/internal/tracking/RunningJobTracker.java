package io.fleetcron.internal.tracking;

import io.fleetcron.core.RunScope;
import io.fleetcron.core.RunningJobRecord;
import io.fleetcron.spi.PeerQueryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-flight executions on this node, plus the cluster view assembled from peers.
 *
 * <p>A record is live while its task handle is not done. Records registered without a handle
 * (e.g. adopted from an earlier process) are live while their OS process is.
 */
public class RunningJobTracker {
    private static final Logger log = LoggerFactory.getLogger(RunningJobTracker.class);

    private final String nodeId;
    private final PeerQueryClient peerQueryClient;
    private final Duration peerTimeout;
    private final Duration overallTimeout;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> byJid = new LinkedHashMap<>();

    private record Entry(RunningJobRecord record, Future<?> handle) {
    }

    public RunningJobTracker(String nodeId, PeerQueryClient peerQueryClient, Duration peerTimeout, Duration overallTimeout) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.peerQueryClient = Objects.requireNonNull(peerQueryClient, "peerQueryClient must not be null");
        this.peerTimeout = Objects.requireNonNull(peerTimeout, "peerTimeout must not be null");
        this.overallTimeout = Objects.requireNonNull(overallTimeout, "overallTimeout must not be null");
    }

    public String nodeId() {
        return nodeId;
    }

    public void recordStart(RunningJobRecord record, Future<?> handle) {
        Objects.requireNonNull(record, "record must not be null");
        lock.writeLock().lock();
        try {
            byJid.put(record.jid(), new Entry(record, handle));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Tracking job={} jid={}", record.jobName(), record.jid());
    }

    public Optional<RunningJobRecord> recordEnd(String jid) {
        lock.writeLock().lock();
        try {
            Entry removed = byJid.remove(jid);
            return removed == null ? Optional.empty() : Optional.of(removed.record());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Live local executions of {@code jobName}; this is what a peer query is answered with.
     */
    public List<RunningJobRecord> running(String jobName) {
        lock.readLock().lock();
        try {
            List<RunningJobRecord> out = new ArrayList<>();
            for (Entry e : byJid.values()) {
                if (e.record().jobName().equals(jobName) && isAlive(e)) {
                    out.add(e.record());
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RunningJobRecord> all() {
        lock.readLock().lock();
        try {
            return byJid.values().stream().map(Entry::record).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int countRunning(String jobName, RunScope scope) {
        return countRunning(jobName, scope, overallTimeout);
    }

    /**
     * Like {@link #countRunning(String, RunScope)}, but waits at most {@code maxWait} for peers.
     * Peers that have not answered by then count as zero.
     */
    public int countRunning(String jobName, RunScope scope, Duration maxWait) {
        int local = running(jobName).size();
        if (scope != RunScope.CLUSTER) {
            return local;
        }
        Duration wait = maxWait == null || maxWait.compareTo(overallTimeout) > 0 ? overallTimeout : maxWait;
        return local + countOnPeers(jobName, wait.isNegative() ? Duration.ZERO : wait);
    }

    /**
     * Drops records whose execution is no longer alive.
     *
     * @return number of records removed
     */
    public int reapStale() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<Entry> it = byJid.values().iterator();
            while (it.hasNext()) {
                Entry e = it.next();
                // handle-backed records are ended by the scheduler when it reaps the completion
                if (e.handle() == null && !isAlive(e)) {
                    it.remove();
                    removed++;
                    log.info("Removed stale running record job={} jid={} pid={}", e.record().jobName(), e.record().jid(), e.record().pid());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    private int countOnPeers(String jobName, Duration wait) {
        List<String> peers = peerQueryClient.peers();
        if (peers.isEmpty()) {
            return 0;
        }
        List<CompletableFuture<Integer>> counts = new ArrayList<>(peers.size());
        for (String peer : peers) {
            counts.add(queryPeer(peer, jobName));
        }
        try {
            CompletableFuture.allOf(counts.toArray(new CompletableFuture<?>[0]))
                    .get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Peer query for job={} exceeded wait={}, counting late peers as zero", jobName, wait);
        } catch (ExecutionException ex) {
            log.warn("Peer query for job={} failed msg={}", jobName, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while querying peers for job={}", jobName);
        }
        int total = 0;
        for (CompletableFuture<Integer> c : counts) {
            total += c.getNow(0);
        }
        return total;
    }

    private CompletableFuture<Integer> queryPeer(String peer, String jobName) {
        CompletableFuture<List<RunningJobRecord>> answer;
        try {
            answer = peerQueryClient.queryRunning(peer, jobName);
        } catch (RuntimeException ex) {
            log.warn("Peer query to peer={} for job={} failed msg={}", peer, jobName, ex.getMessage());
            return CompletableFuture.completedFuture(0);
        }
        return answer
                .completeOnTimeout(List.of(), peerTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    log.warn("Peer query to peer={} for job={} failed msg={}", peer, jobName, ex.getMessage());
                    return List.of();
                })
                .thenApply(records -> (int) records.stream()
                        .filter(r -> jobName.equals(r.jobName()))
                        .filter(r -> !nodeId.equals(r.nodeId()))
                        .count());
    }

    private static boolean isAlive(Entry e) {
        if (e.handle() != null) {
            return !e.handle().isDone();
        }
        return ProcessHandle.of(e.record().pid()).map(ProcessHandle::isAlive).orElse(false);
    }
}
