package msgrepl.node;

import msgrepl.common.MessageAudit;
import msgrepl.common.Types.Mode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-node shared state: configuration, membership, the message log, the audit
 * trail, the operator's live-peer filter and the last observed reachability of
 * each peer.
 */
public final class NodeState {
    private static final Logger LOG = LoggerFactory.getLogger(NodeState.class);

    private final NodeConfig nodeConfig;
    private final ClusterView clusterView;
    private final MessageStore store;
    private final MessageAudit audit;

    private volatile Set<Integer> livePeerIds = Collections.emptySet();
    private volatile boolean selfAllowed = true;
    private final ConcurrentMap<Integer, Boolean> lastObservedReachable = new ConcurrentHashMap<>();

    public NodeState(NodeConfig cfg) {
        this(cfg, StaticClusterView.of(cfg), new MessageStore());
    }

    public NodeState(NodeConfig cfg, ClusterView clusterView, MessageStore store) {
        this.nodeConfig = cfg;
        this.clusterView = clusterView;
        this.store = store;
        this.audit = new MessageAudit(cfg.getNodeId(), cfg.getAuditMaxEntries());
    }

    public NodeConfig getNodeConfig() { return nodeConfig; }
    public ClusterView getClusterView() { return clusterView; }
    public MessageStore getStore() { return store; }
    public MessageAudit getAudit() { return audit; }
    public int getNodeId() { return nodeConfig.getNodeId(); }
    public long getIncarnation() { return nodeConfig.getIncarnation(); }
    public Mode getMode() { return nodeConfig.getMode(); }

    /**
     * Restricts traffic to the given nodes. An empty set lifts the filter.
     *
     * @return peers that became reachable through this change
     */
    public Set<Integer> setLivePeerIds(Set<Integer> peers) {
        Set<Integer> previous = livePeerIds;
        Set<Integer> next;
        if (peers == null || peers.isEmpty()) {
            next = Collections.emptySet();
        } else {
            next = Collections.unmodifiableSet(new LinkedHashSet<>(peers));
        }
        livePeerIds = next;
        selfAllowed = next.isEmpty() || next.contains(getNodeId());
        return computeNewlyEnabledPeers(previous, next);
    }

    public Set<Integer> getLivePeerIds() {
        return livePeerIds;
    }

    public boolean isPeerAllowed(int peerId) {
        if (!selfAllowed) return false;
        Set<Integer> current = livePeerIds;
        return current.isEmpty() || current.contains(peerId);
    }

    public boolean isSelfAllowed() {
        return selfAllowed;
    }

    private Set<Integer> computeNewlyEnabledPeers(Set<Integer> previous, Set<Integer> current) {
        Set<Integer> prevEffective = expandPeerFilter(previous);
        Set<Integer> currentEffective = expandPeerFilter(current);
        currentEffective.removeAll(prevEffective);
        currentEffective.remove(getNodeId());
        return currentEffective;
    }

    private Set<Integer> expandPeerFilter(Set<Integer> filter) {
        boolean selfIn = filter.isEmpty() || filter.contains(getNodeId());
        if (!selfIn) return new LinkedHashSet<>();
        return new LinkedHashSet<>(filter.isEmpty() ? clusterView.members() : filter);
    }

    /**
     * Records the outcome of the latest call to a peer. Transitions are logged once
     * instead of on every failed call.
     */
    public void notePeerReachable(int peerId, boolean reachable) {
        Boolean prev = lastObservedReachable.put(peerId, reachable);
        if (prev == null || prev != reachable) {
            if (reachable) {
                LOG.info("[Node {}] peer {} is reachable", getNodeId(), peerId);
            } else {
                LOG.warn("[Node {}] peer {} is unreachable", getNodeId(), peerId);
            }
        }
    }

    /** Last observed reachability per peer; peers never contacted are absent. */
    public Map<Integer, Boolean> observedReachability() {
        return Map.copyOf(lastObservedReachable);
    }
}
