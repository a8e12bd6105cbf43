package msgrepl.common;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded in-memory trail of every replication message a node sent or received.
 * Oldest entries are dropped once {@code maxEntries} is exceeded; a bound of zero
 * disables auditing.
 */
public final class MessageAudit {

    public enum Dir { SENT, RECV }

    public enum Kind { SUBMIT, REPLICATE, ACK, NACK, COMMIT, REJECT, EXCHANGE, PUSH, MERGE }

    public static final class Entry {
        public final long ts;
        public final int selfNodeId;
        public final Dir dir;
        public final Kind kind;
        public final int peerNodeId;
        public final String messageId;
        public final String note;

        public Entry(long ts, int selfNodeId, Dir dir, Kind kind, int peerNodeId, String messageId, String note) {
            this.ts = ts;
            this.selfNodeId = selfNodeId;
            this.dir = Objects.requireNonNull(dir);
            this.kind = Objects.requireNonNull(kind);
            this.peerNodeId = peerNodeId;
            this.messageId = messageId;
            this.note = note;
        }
    }

    private static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final int selfNodeId;
    private final int maxEntries;
    private final ConcurrentLinkedQueue<Entry> q = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger(0);

    public MessageAudit(int selfNodeId) {
        this(selfNodeId, DEFAULT_MAX_ENTRIES);
    }

    public MessageAudit(int selfNodeId, int maxEntries) {
        this.selfNodeId = selfNodeId;
        this.maxEntries = maxEntries;
    }

    public void log(Dir dir, Kind kind, Integer peerNodeId, String messageId, String note) {
        if (maxEntries <= 0) {
            return;
        }
        final int peer = (peerNodeId == null ? -1 : peerNodeId);
        q.add(new Entry(Instant.now().toEpochMilli(), selfNodeId, dir, kind, peer, messageId, note));

        int cur = size.incrementAndGet();
        if (cur > maxEntries) {
            while (size.get() > maxEntries) {
                Entry dropped = q.poll();
                if (dropped == null) break;
                size.decrementAndGet();
            }
        }
    }

    public List<Entry> snapshot() {
        return new ArrayList<>(q);
    }

    public int size() {
        return size.get();
    }
}
