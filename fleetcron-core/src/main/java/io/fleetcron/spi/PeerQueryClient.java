package io.fleetcron.spi;

import io.fleetcron.core.RunningJobRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * RPC used by cluster-scoped admission to ask peers what they are running.
 */
public interface PeerQueryClient {

    /**
     * Peers to query, excluding this node.
     */
    List<String> peers();

    /**
     * Asks {@code peer} for its running instances of {@code jobName}. The future may complete
     * exceptionally or never; callers apply their own timeouts.
     */
    CompletableFuture<List<RunningJobRecord>> queryRunning(String peer, String jobName);

    /**
     * Client for a node without peers.
     */
    static PeerQueryClient none() {
        return new PeerQueryClient() {
            @Override
            public List<String> peers() {
                return List.of();
            }

            @Override
            public CompletableFuture<List<RunningJobRecord>> queryRunning(String peer, String jobName) {
                return CompletableFuture.completedFuture(List.of());
            }
        };
    }
}
