package msgrepl.client;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import msgrepl.proto.NodeServiceGrpc;
import msgrepl.proto.ReplProto.AuditDump;
import msgrepl.proto.ReplProto.Empty;
import msgrepl.proto.ReplProto.HealthReply;
import msgrepl.proto.ReplProto.LivePeers;
import msgrepl.proto.ReplProto.MessageList;
import msgrepl.proto.ReplProto.SubmitReply;
import msgrepl.proto.ReplProto.SubmitRequest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Client-side handle on every node of the cluster, keyed by node id.
 */
final class ClusterCoordinator implements AutoCloseable {

    private final Map<Integer, NodeServiceGrpc.NodeServiceBlockingStub> stubs = new TreeMap<>();
    private final List<ManagedChannel> channels = new ArrayList<>();
    private final long timeoutMs;

    ClusterCoordinator(Map<Integer, ManagedChannel> channels, long timeoutMs) {
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("No node targets configured, pass -Dpeer.<id>=host:port");
        }
        this.timeoutMs = timeoutMs;
        channels.forEach((id, ch) -> {
            this.channels.add(ch);
            stubs.put(id, NodeServiceGrpc.newBlockingStub(ch));
        });
    }

    static ClusterCoordinator connect(Map<Integer, String> targets, long timeoutMs) {
        Map<Integer, ManagedChannel> channels = new TreeMap<>();
        targets.forEach((id, target) -> channels.put(id, ManagedChannelBuilder.forTarget(target).usePlaintext().build()));
        return new ClusterCoordinator(channels, timeoutMs);
    }

    Collection<Integer> nodeIds() {
        return stubs.keySet();
    }

    private NodeServiceGrpc.NodeServiceBlockingStub stub(int nodeId) {
        NodeServiceGrpc.NodeServiceBlockingStub stub = stubs.get(nodeId);
        if (stub == null) {
            throw new IllegalArgumentException("Unknown node " + nodeId + ", known: " + stubs.keySet());
        }
        return stub.withDeadlineAfter(timeoutMs, TimeUnit.MILLISECONDS);
    }

    SubmitReply submit(int nodeId, String user, String text) {
        return stub(nodeId).submitMessage(SubmitRequest.newBuilder().setUser(user).setText(text).build());
    }

    MessageList list(int nodeId) {
        return stub(nodeId).listMessages(Empty.getDefaultInstance());
    }

    HealthReply health(int nodeId) {
        return stub(nodeId).health(Empty.getDefaultInstance());
    }

    AuditDump audit(int nodeId) {
        return stub(nodeId).getAudit(Empty.getDefaultInstance());
    }

    /**
     * Applies the same live-node filter on every node. Nodes that cannot be reached
     * are reported and skipped.
     */
    List<Integer> setLiveNodes(Collection<Integer> live) {
        List<Integer> failed = new ArrayList<>();
        LivePeers req = LivePeers.newBuilder().addAllNodeIds(live).build();
        for (int id : stubs.keySet()) {
            try {
                stub(id).setLivePeers(req);
            } catch (StatusRuntimeException e) {
                failed.add(id);
            }
        }
        return failed;
    }

    @Override
    public void close() {
        for (ManagedChannel ch : channels) {
            try {
                ch.shutdownNow().awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
