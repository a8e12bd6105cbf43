package msgrepl.common;

import msgrepl.proto.ReplProto.Digest;
import msgrepl.proto.ReplProto.MessageEntry;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public class Types {

    public enum Mode {
        QUORUM, GOSSIP;

        public static Mode parse(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("mode must be one of quorum|gossip");
            }
            switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "quorum":
                case "strong":
                    return QUORUM;
                case "gossip":
                case "eventual":
                    return GOSSIP;
                default:
                    throw new IllegalArgumentException("Unknown mode '" + raw + "', expected quorum|gossip");
            }
        }

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    // Quorum write lifecycle
    public enum WriteState { PROPOSING, COLLECTING, COMMITTED, REJECTED }

    /** Messages of one node boot: {@code "<origin>-<incarnation>"}. */
    public static String streamKey(int originNode, long incarnation) {
        return originNode + "-" + incarnation;
    }

    public static String messageId(int originNode, long incarnation, long version) {
        return streamKey(originNode, incarnation) + "-" + version;
    }

    /**
     * A user message as stored in every node's log. Immutable; identity is
     * {@code (originNode, incarnation, version)}. The incarnation is fixed per node
     * boot, so a restarted node never reissues an id.
     */
    public static final class Message {
        public static final Comparator<Message> BY_ORIGIN_VERSION =
                Comparator.comparingInt(Message::getOriginNode)
                        .thenComparingLong(Message::getIncarnation)
                        .thenComparingLong(Message::getVersion);

        private final String id;
        private final String text;
        private final String user;
        private final int originNode;
        private final long incarnation;
        private final long version;
        private final long acceptedAt;

        public Message(int originNode, long incarnation, long version, String text, String user, long acceptedAt) {
            if (incarnation <= 0) throw new ValidationException("incarnation must be positive: " + incarnation);
            if (version <= 0) throw new ValidationException("version must be positive: " + version);
            this.id = messageId(originNode, incarnation, version);
            this.text = Objects.requireNonNull(text, "text");
            this.user = Objects.requireNonNull(user, "user");
            this.originNode = originNode;
            this.incarnation = incarnation;
            this.version = version;
            this.acceptedAt = acceptedAt;
        }

        public String getId() { return id; }
        public String getText() { return text; }
        public String getUser() { return user; }
        public int getOriginNode() { return originNode; }
        public long getIncarnation() { return incarnation; }
        public String getStreamKey() { return streamKey(originNode, incarnation); }
        public long getVersion() { return version; }
        public long getAcceptedAt() { return acceptedAt; }

        public MessageEntry toProto() {
            return MessageEntry.newBuilder()
                    .setId(id)
                    .setText(text)
                    .setUser(user)
                    .setOriginNode(originNode)
                    .setIncarnation(incarnation)
                    .setVersion(version)
                    .setAcceptedAt(acceptedAt)
                    .build();
        }

        // The id on the wire is recomputed, a mismatching one is malformed input.
        public static Message of(MessageEntry e) {
            Message m = new Message(e.getOriginNode(), e.getIncarnation(), e.getVersion(),
                    e.getText(), e.getUser(), e.getAcceptedAt());
            if (!e.getId().isEmpty() && !e.getId().equals(m.id)) {
                throw new ValidationException("message id " + e.getId() + " does not match origin/incarnation/version " + m.id);
            }
            return m;
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Message)) return false;
            return id.equals(((Message) o).id);
        }
        @Override public int hashCode() { return id.hashCode(); }
        @Override public String toString() {
            return "Message{" + id + " user=" + user + " text='" + text + "'}";
        }
    }

    public static Map<String, Long> digestOf(Digest d) {
        if (d == null) return Collections.emptyMap();
        return new HashMap<>(d.getHighestVersionsMap());
    }

    public static Digest toDigest(Map<String, Long> highest) {
        return Digest.newBuilder().putAllHighestVersions(highest).build();
    }
}
