package io.fleetcron.internal.coordination;

import io.fleetcron.core.CoordinationUnavailableException;
import io.fleetcron.spi.CoordinationClient;
import io.fleetcron.spi.SessionListener;
import io.fleetcron.spi.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local stand-in for a ZooKeeper-like node service.
 *
 * <p>Each {@link #openSession()} returns a client bound to its own session. Ephemeral nodes go away
 * with their session ({@link Session#close()} or {@link #expire(Session)}), and child watches fire
 * once on the next change. {@link #setAvailable(boolean)} simulates losing the service: while
 * unavailable every call throws {@link CoordinationUnavailableException}.
 */
public class InMemoryCoordinationService {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCoordinationService.class);

    private final Object monitor = new Object();
    private final Map<String, Map<String, Node>> childrenByParent = new HashMap<>();
    private final Map<String, AtomicLong> sequences = new HashMap<>();
    private final Map<String, List<Runnable>> watches = new HashMap<>();
    private final List<Session> sessions = new CopyOnWriteArrayList<>();
    private final AtomicLong sessionIds = new AtomicLong();
    private volatile boolean available = true;

    private record Node(byte[] data, long sequence, long sessionId) {
    }

    public Session openSession() {
        Session session = new Session(sessionIds.incrementAndGet());
        sessions.add(session);
        return session;
    }

    /**
     * Ends {@code session} as the service would after a session timeout: its nodes are removed and
     * its listeners see {@link SessionState#LOST}.
     */
    public void expire(Session session) {
        endSession(session);
        log.info("Coordination session expired id={}", session.id);
        session.notifyListeners(SessionState.LOST);
    }

    public void setAvailable(boolean available) {
        if (this.available == available) {
            return;
        }
        this.available = available;
        SessionState state = available ? SessionState.RECONNECTED : SessionState.SUSPENDED;
        for (Session s : sessions) {
            s.notifyListeners(state);
        }
    }

    private void endSession(Session session) {
        List<Runnable> fired = new ArrayList<>();
        synchronized (monitor) {
            if (session.closed) {
                return;
            }
            session.closed = true;
            for (Map.Entry<String, Map<String, Node>> e : childrenByParent.entrySet()) {
                boolean changed = e.getValue().values().removeIf(n -> n.sessionId() == session.id);
                if (changed) {
                    fired.addAll(takeWatches(e.getKey()));
                }
            }
        }
        sessions.remove(session);
        fired.forEach(Runnable::run);
    }

    // caller holds the monitor
    private List<Runnable> takeWatches(String parent) {
        List<Runnable> w = watches.remove(parent);
        return w == null ? List.of() : w;
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash <= 0 ? "/" : path.substring(0, slash);
    }

    private static String nameOf(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public final class Session implements CoordinationClient {
        private final long id;
        private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
        private volatile boolean closed;

        private Session(long id) {
            this.id = id;
        }

        public long id() {
            return id;
        }

        /**
         * Ends the session normally, removing its ephemeral nodes.
         */
        public void close() {
            endSession(this);
        }

        @Override
        public String createEphemeralSequential(String parentPath, String prefix, byte[] data) {
            List<Runnable> fired;
            String path;
            synchronized (monitor) {
                check();
                long seq = sequences.computeIfAbsent(parentPath, p -> new AtomicLong()).getAndIncrement();
                String name = prefix + String.format("%010d", seq);
                childrenByParent.computeIfAbsent(parentPath, p -> new HashMap<>())
                        .put(name, new Node(data == null ? new byte[0] : data.clone(), seq, id));
                path = parentPath + "/" + name;
                fired = takeWatches(parentPath);
            }
            fired.forEach(Runnable::run);
            return path;
        }

        @Override
        public List<String> getChildren(String path) {
            synchronized (monitor) {
                check();
                Map<String, Node> children = childrenByParent.get(path);
                if (children == null) {
                    return List.of();
                }
                return children.entrySet().stream()
                        .sorted(Comparator.comparingLong(e -> e.getValue().sequence()))
                        .map(Map.Entry::getKey)
                        .toList();
            }
        }

        @Override
        public byte[] getData(String path) {
            synchronized (monitor) {
                check();
                Map<String, Node> children = childrenByParent.get(parentOf(path));
                Node node = children == null ? null : children.get(nameOf(path));
                return node == null ? null : node.data().clone();
            }
        }

        @Override
        public boolean exists(String path) {
            synchronized (monitor) {
                check();
                Map<String, Node> children = childrenByParent.get(parentOf(path));
                return children != null && children.containsKey(nameOf(path));
            }
        }

        @Override
        public boolean delete(String path) {
            List<Runnable> fired = List.of();
            boolean removed;
            synchronized (monitor) {
                check();
                String parent = parentOf(path);
                Map<String, Node> children = childrenByParent.get(parent);
                removed = children != null && children.remove(nameOf(path)) != null;
                if (removed) {
                    fired = takeWatches(parent);
                }
            }
            fired.forEach(Runnable::run);
            return removed;
        }

        @Override
        public void watchChildren(String path, Runnable callback) {
            synchronized (monitor) {
                check();
                watches.computeIfAbsent(path, p -> new ArrayList<>()).add(callback);
            }
        }

        @Override
        public void addSessionListener(SessionListener listener) {
            listeners.add(listener);
        }

        @Override
        public void removeSessionListener(SessionListener listener) {
            listeners.remove(listener);
        }

        @Override
        public boolean isConnected() {
            return available && !closed;
        }

        private void check() {
            if (closed) {
                throw new CoordinationUnavailableException("session " + id + " has expired");
            }
            if (!available) {
                throw new CoordinationUnavailableException("coordination service is unavailable");
            }
        }

        private void notifyListeners(SessionState state) {
            for (SessionListener l : listeners) {
                try {
                    l.stateChanged(state);
                } catch (RuntimeException ex) {
                    log.error("Session listener failed session={} state={} msg={}", id, state, ex.getMessage(), ex);
                }
            }
        }
    }
}
