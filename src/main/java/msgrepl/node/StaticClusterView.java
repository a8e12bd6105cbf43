package msgrepl.node;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class StaticClusterView implements ClusterView {
    private final int selfId;
    private final Map<Integer, String> addresses;
    private final List<Integer> members;
    private final List<Integer> peers;

    public StaticClusterView(int selfId, Map<Integer, String> addresses) {
        if (!addresses.containsKey(selfId)) {
            throw new IllegalArgumentException("cluster membership " + addresses.keySet() + " does not include self " + selfId);
        }
        this.selfId = selfId;
        this.addresses = Map.copyOf(addresses);
        this.members = List.copyOf(new TreeMap<>(addresses).keySet());
        this.peers = members.stream().filter(id -> id != selfId).collect(Collectors.toUnmodifiableList());
    }

    public static StaticClusterView of(NodeConfig cfg) {
        return new StaticClusterView(cfg.getNodeId(), cfg.getPeers());
    }

    @Override public int selfId() { return selfId; }
    @Override public List<Integer> members() { return members; }
    @Override public List<Integer> peers() { return peers; }

    @Override
    public Optional<String> addressOf(int nodeId) {
        return Optional.ofNullable(addresses.get(nodeId));
    }

    @Override public String toString() {
        return "ClusterView{self=" + selfId + " members=" + members + " quorum=" + quorumSize() + "}";
    }
}
