package msgrepl.rpc;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import msgrepl.common.Types;
import msgrepl.common.Types.Message;
import msgrepl.node.NodeState;
import msgrepl.proto.NodeServiceGrpc;
import msgrepl.proto.ReplProto.ExchangeMsg;
import msgrepl.proto.ReplProto.ExchangeReply;
import msgrepl.proto.ReplProto.MessageEntry;
import msgrepl.proto.ReplProto.PushAck;
import msgrepl.proto.ReplProto.PushMsg;
import msgrepl.proto.ReplProto.ReplicateMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link Transport} over gRPC blocking stubs, one channel per peer. Each call carries
 * a deadline of {@code rpcTimeoutMs}; gRPC status codes are translated into
 * {@link TransportException.Failure} kinds.
 */
public final class GrpcTransport implements Transport {
    private static final Logger LOG = LoggerFactory.getLogger(GrpcTransport.class);

    private final NodeState state;
    private final Map<Integer, ManagedChannel> channels;
    private final Map<Integer, NodeServiceGrpc.NodeServiceBlockingStub> stubs = new HashMap<>();
    private final long rpcTimeoutMs;

    public GrpcTransport(NodeState state, Map<Integer, ManagedChannel> channels) {
        this.state = state;
        this.channels = Map.copyOf(channels);
        this.rpcTimeoutMs = state.getNodeConfig().getRpcTimeoutMs();
        this.channels.forEach((id, ch) -> stubs.put(id, NodeServiceGrpc.newBlockingStub(ch)));
    }

    /** Opens a plaintext channel to every peer in the cluster view. */
    public static GrpcTransport connect(NodeState state) {
        Map<Integer, ManagedChannel> channels = new HashMap<>();
        for (int peerId : state.getClusterView().peers()) {
            String address = state.getClusterView().addressOf(peerId)
                    .orElseThrow(() -> new IllegalArgumentException("no address for peer " + peerId));
            channels.put(peerId, ManagedChannelBuilder.forTarget(address).usePlaintext().build());
        }
        return new GrpcTransport(state, channels);
    }

    private NodeServiceGrpc.NodeServiceBlockingStub stub(int peerId) {
        if (!state.isPeerAllowed(peerId)) {
            throw new TransportException(peerId, TransportException.Failure.UNREACHABLE, "peer filtered out");
        }
        NodeServiceGrpc.NodeServiceBlockingStub stub = stubs.get(peerId);
        if (stub == null) {
            throw new TransportException(peerId, TransportException.Failure.UNREACHABLE, "unknown peer");
        }
        return stub.withDeadlineAfter(rpcTimeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public Transport.ReplicateAck replicate(int peerId, Message message) {
        ReplicateMsg req = ReplicateMsg.newBuilder()
                .setFromNode(state.getNodeId())
                .setMessage(message.toProto())
                .build();
        msgrepl.proto.ReplProto.ReplicateAck ack;
        try {
            ack = stub(peerId).replicate(req);
        } catch (StatusRuntimeException e) {
            throw translate(peerId, "replicate", e);
        }
        if (!ack.getOk()) {
            throw new TransportException(peerId, TransportException.Failure.REJECTED, "replicate refused");
        }
        return new Transport.ReplicateAck(ack.getNodeId(), ack.getDuplicate());
    }

    @Override
    public ExchangeResult exchange(int peerId, Map<String, Long> localDigest) {
        ExchangeMsg req = ExchangeMsg.newBuilder()
                .setFromNode(state.getNodeId())
                .setDigest(Types.toDigest(localDigest))
                .build();
        ExchangeReply reply;
        try {
            reply = stub(peerId).exchange(req);
        } catch (StatusRuntimeException e) {
            throw translate(peerId, "exchange", e);
        }
        List<Message> missing = new ArrayList<>(reply.getMissingCount());
        for (MessageEntry e : reply.getMissingList()) {
            missing.add(Message.of(e));
        }
        return new ExchangeResult(reply.getNodeId(), Types.digestOf(reply.getDigest()), missing);
    }

    @Override
    public int push(int peerId, List<Message> messages) {
        PushMsg.Builder req = PushMsg.newBuilder().setFromNode(state.getNodeId());
        messages.forEach(m -> req.addMessages(m.toProto()));
        try {
            PushAck ack = stub(peerId).push(req.build());
            return ack.getMerged();
        } catch (StatusRuntimeException e) {
            throw translate(peerId, "push", e);
        }
    }

    static TransportException translate(int peerId, String call, StatusRuntimeException e) {
        Status.Code code = e.getStatus().getCode();
        TransportException.Failure failure;
        switch (code) {
            case DEADLINE_EXCEEDED:
            case CANCELLED:
                failure = TransportException.Failure.TIMEOUT;
                break;
            case UNAVAILABLE:
                failure = TransportException.Failure.UNREACHABLE;
                break;
            case INVALID_ARGUMENT:
            case FAILED_PRECONDITION:
            case PERMISSION_DENIED:
                failure = TransportException.Failure.REJECTED;
                break;
            default:
                failure = TransportException.Failure.ERROR;
        }
        return new TransportException(peerId, failure, call + " " + code + " " + e.getStatus().getDescription(), e);
    }

    @Override
    public void close() {
        channels.forEach((id, ch) -> {
            try {
                ch.shutdownNow().awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        });
        LOG.debug("[Node {}] closed {} peer channels", state.getNodeId(), channels.size());
    }
}
