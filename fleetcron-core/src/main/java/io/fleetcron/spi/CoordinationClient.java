package io.fleetcron.spi;

import io.fleetcron.core.CoordinationUnavailableException;

import java.util.List;

/**
 * Client of an ordered, ephemeral, watchable node service (ZooKeeper-like), bound to one session.
 *
 * <p>Every method throws {@link CoordinationUnavailableException} when the service cannot be reached
 * or the session has expired.
 */
public interface CoordinationClient {

    /**
     * Creates an ephemeral node named {@code prefix + zero-padded sequence} under {@code parentPath},
     * creating missing parents. The node disappears when this client's session ends.
     *
     * @return full path of the created node
     */
    String createEphemeralSequential(String parentPath, String prefix, byte[] data);

    /**
     * Child names of {@code path} in sequence order; empty when the path does not exist.
     */
    List<String> getChildren(String path);

    /**
     * Node data, or null when the node does not exist.
     */
    byte[] getData(String path);

    boolean exists(String path);

    /**
     * Deletes the node. Deleting a missing node is not an error.
     *
     * @return true if a node was removed
     */
    boolean delete(String path);

    /**
     * One-shot watch fired on the next change to the children of {@code path}.
     */
    void watchChildren(String path, Runnable callback);

    void addSessionListener(SessionListener listener);

    void removeSessionListener(SessionListener listener);

    boolean isConnected();
}
