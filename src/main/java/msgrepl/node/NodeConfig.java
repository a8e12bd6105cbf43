package msgrepl.node;

import msgrepl.common.Types.Mode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Boot-time configuration of one node. Immutable once built.
 * <p>
 * {@code peers} maps every cluster member, self included, to its {@code host:port}.
 */
public class NodeConfig {
    static final long DEFAULT_GOSSIP_INTERVAL_MS = 1000L;
    static final int DEFAULT_GOSSIP_FANOUT = 1;
    static final long DEFAULT_RPC_TIMEOUT_MS = 800L;
    static final int DEFAULT_AUDIT_MAX_ENTRIES = 10_000;

    private final int nodeId;
    private final int port;
    private final Map<Integer, String> peers;
    private final Mode mode;
    private final long gossipIntervalMs;
    private final int gossipFanout;
    private final long rpcTimeoutMs;
    private final int auditMaxEntries;
    private final long incarnation;

    private NodeConfig(Builder b) {
        if (b.nodeId <= 0) throw new IllegalArgumentException("nodeId must be positive: " + b.nodeId);
        if (b.mode == null) throw new IllegalArgumentException("mode is required");
        if (b.gossipIntervalMs <= 0) throw new IllegalArgumentException("gossipIntervalMs must be positive");
        if (b.rpcTimeoutMs <= 0) throw new IllegalArgumentException("rpcTimeoutMs must be positive");
        if (b.incarnation <= 0) throw new IllegalArgumentException("incarnation must be positive");
        this.nodeId = b.nodeId;
        this.port = b.port;
        Map<Integer, String> all = new TreeMap<>(b.peers);
        all.putIfAbsent(b.nodeId, "localhost:" + b.port);
        this.peers = Map.copyOf(all);
        this.mode = b.mode;
        this.gossipIntervalMs = b.gossipIntervalMs;
        this.gossipFanout = b.gossipFanout;
        this.rpcTimeoutMs = b.rpcTimeoutMs;
        this.auditMaxEntries = b.auditMaxEntries;
        this.incarnation = b.incarnation;
    }

    public int getNodeId() { return nodeId; }
    public int getPort() { return port; }
    public Map<Integer, String> getPeers() { return peers; }
    public Mode getMode() { return mode; }
    public long getGossipIntervalMs() { return gossipIntervalMs; }
    public int getGossipFanout() { return gossipFanout; }
    public long getRpcTimeoutMs() { return rpcTimeoutMs; }
    public int getAuditMaxEntries() { return auditMaxEntries; }

    /** Identifies this boot of the node; part of every message id the node issues. */
    public long getIncarnation() { return incarnation; }

    public static Builder builder(int nodeId) {
        return new Builder(nodeId);
    }

    public static NodeConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads {@code nodeId}, {@code port}, {@code peer.<id>=host:port}, {@code mode},
     * {@code gossipIntervalMs}, {@code gossipFanout}, {@code rpcTimeoutMs},
     * {@code auditMaxEntries} and {@code incarnation} (boot time in millis if unset).
     */
    public static NodeConfig fromProperties(Properties props) {
        int nodeId = parseInt(props, "nodeId", 1);
        int port = parseInt(props, "port", 50050 + nodeId);

        Map<Integer, String> peers = new LinkedHashMap<>();
        props.forEach((k, v) -> {
            String ks = String.valueOf(k);
            if (ks.startsWith("peer.")) {
                String idPart = ks.substring("peer.".length());
                try {
                    peers.put(Integer.parseInt(idPart), String.valueOf(v).trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Bad peer property '" + ks + "', expected peer.<nodeId>", e);
                }
            }
        });

        return builder(nodeId)
                .port(port)
                .peers(peers)
                .mode(Mode.parse(props.getProperty("mode", "quorum")))
                .gossipIntervalMs(parseLong(props, "gossipIntervalMs", DEFAULT_GOSSIP_INTERVAL_MS))
                .gossipFanout(parseInt(props, "gossipFanout", DEFAULT_GOSSIP_FANOUT))
                .rpcTimeoutMs(parseLong(props, "rpcTimeoutMs", DEFAULT_RPC_TIMEOUT_MS))
                .auditMaxEntries(parseInt(props, "auditMaxEntries", DEFAULT_AUDIT_MAX_ENTRIES))
                .incarnation(parseLong(props, "incarnation", System.currentTimeMillis()))
                .build();
    }

    private static int parseInt(Properties props, String key, int def) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + raw, e);
        }
    }

    private static long parseLong(Properties props, String key, long def) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + raw, e);
        }
    }

    @Override public String toString() {
        return "NodeConfig{node=" + nodeId + " port=" + port + " mode=" + mode.wireName()
                + " peers=" + peers + " gossipIntervalMs=" + gossipIntervalMs
                + " gossipFanout=" + gossipFanout + " rpcTimeoutMs=" + rpcTimeoutMs
                + " incarnation=" + incarnation + "}";
    }

    public static final class Builder {
        private final int nodeId;
        private int port;
        private final Map<Integer, String> peers = new LinkedHashMap<>();
        private Mode mode = Mode.QUORUM;
        private long gossipIntervalMs = DEFAULT_GOSSIP_INTERVAL_MS;
        private int gossipFanout = DEFAULT_GOSSIP_FANOUT;
        private long rpcTimeoutMs = DEFAULT_RPC_TIMEOUT_MS;
        private int auditMaxEntries = DEFAULT_AUDIT_MAX_ENTRIES;
        private long incarnation = System.currentTimeMillis();

        private Builder(int nodeId) {
            this.nodeId = nodeId;
            this.port = 50050 + nodeId;
        }

        public Builder port(int port) { this.port = port; return this; }
        public Builder peer(int id, String address) { this.peers.put(id, address); return this; }
        public Builder peers(Map<Integer, String> peers) { this.peers.putAll(peers); return this; }
        public Builder mode(Mode mode) { this.mode = mode; return this; }
        public Builder gossipIntervalMs(long ms) { this.gossipIntervalMs = ms; return this; }
        public Builder gossipFanout(int fanout) { this.gossipFanout = fanout; return this; }
        public Builder rpcTimeoutMs(long ms) { this.rpcTimeoutMs = ms; return this; }
        public Builder auditMaxEntries(int max) { this.auditMaxEntries = max; return this; }
        public Builder incarnation(long incarnation) { this.incarnation = incarnation; return this; }

        public NodeConfig build() {
            return new NodeConfig(this);
        }
    }
}
