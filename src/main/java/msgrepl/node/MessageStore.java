package msgrepl.node;

import msgrepl.common.Types;
import msgrepl.common.Types.Message;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, identity-deduplicated log of messages held by one node.
 * <p>
 * Watermarks are kept per stream, one stream per (origin, incarnation), so the
 * messages a node wrote before a restart stay distinguishable from the ones it
 * writes after. Entries are never removed or replaced. Listing order is local insertion order and
 * is not expected to match across nodes. All state sits behind one read/write lock.
 */
public final class MessageStore {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Message> byId = new HashMap<>();
    private final List<Message> ordered = new ArrayList<>();
    private final Map<String, Long> highestByStream = new HashMap<>();

    /**
     * @return false if a message with the same id is already stored (nothing changes)
     */
    public boolean append(Message m) {
        lock.writeLock().lock();
        try {
            return insert(m);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Merges a batch in (origin, incarnation, version) order.
     *
     * @return how many of the messages were new
     */
    public int appendAll(Collection<Message> messages) {
        if (messages.isEmpty()) return 0;
        List<Message> sorted = new ArrayList<>(messages);
        sorted.sort(Message.BY_ORIGIN_VERSION);
        int added = 0;
        lock.writeLock().lock();
        try {
            for (Message m : sorted) {
                if (insert(m)) added++;
            }
        } finally {
            lock.writeLock().unlock();
        }
        return added;
    }

    /**
     * Creates the next message of the stream {@code (origin, incarnation)} and stores
     * it under the same lock, so no reader can see version n+1 of a stream before
     * version n.
     */
    public Message appendLocal(int origin, long incarnation, String text, String user, long acceptedAt) {
        lock.writeLock().lock();
        try {
            long next = highestByStream.getOrDefault(Types.streamKey(origin, incarnation), 0L) + 1;
            Message m = new Message(origin, incarnation, next, text, user, acceptedAt);
            insert(m);
            return m;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean insert(Message m) {
        if (byId.containsKey(m.getId())) {
            return false;
        }
        byId.put(m.getId(), m);
        ordered.add(m);
        highestByStream.merge(m.getStreamKey(), m.getVersion(), Math::max);
        return true;
    }

    public List<Message> listAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(ordered);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String id) {
        lock.readLock().lock();
        try {
            return byId.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public OptionalLong highestVersion(int originNode, long incarnation) {
        lock.readLock().lock();
        try {
            Long v = highestByStream.get(Types.streamKey(originNode, incarnation));
            return v == null ? OptionalLong.empty() : OptionalLong.of(v);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return ordered.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Highest known version per stream. */
    public Map<String, Long> digest() {
        lock.readLock().lock();
        try {
            return Map.copyOf(highestByStream);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Messages above the given per-stream watermarks, sorted by (origin, incarnation,
     * version). Streams absent from {@code remoteDigest} are sent in full.
     */
    public List<Message> missingFrom(Map<String, Long> remoteDigest) {
        List<Message> out = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Message m : ordered) {
                long known = remoteDigest.getOrDefault(m.getStreamKey(), 0L);
                if (m.getVersion() > known) out.add(m);
            }
        } finally {
            lock.readLock().unlock();
        }
        out.sort(Message.BY_ORIGIN_VERSION);
        return out;
    }
}
