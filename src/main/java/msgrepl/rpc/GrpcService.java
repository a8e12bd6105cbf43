package msgrepl.rpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import msgrepl.common.MessageAudit;
import msgrepl.common.Types;
import msgrepl.common.Types.Message;
import msgrepl.common.ValidationException;
import msgrepl.common.WriteResult;
import msgrepl.node.NodeState;
import msgrepl.node.ReplicationCoordinator;
import msgrepl.proto.NodeServiceGrpc;
import msgrepl.proto.ReplProto.AuditDump;
import msgrepl.proto.ReplProto.AuditEntryDump;
import msgrepl.proto.ReplProto.Empty;
import msgrepl.proto.ReplProto.ExchangeMsg;
import msgrepl.proto.ReplProto.ExchangeReply;
import msgrepl.proto.ReplProto.HealthReply;
import msgrepl.proto.ReplProto.LivePeers;
import msgrepl.proto.ReplProto.MessageEntry;
import msgrepl.proto.ReplProto.MessageList;
import msgrepl.proto.ReplProto.PushAck;
import msgrepl.proto.ReplProto.PushMsg;
import msgrepl.proto.ReplProto.ReplicateAck;
import msgrepl.proto.ReplProto.ReplicateMsg;
import msgrepl.proto.ReplProto.SubmitReply;
import msgrepl.proto.ReplProto.SubmitRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class GrpcService extends NodeServiceGrpc.NodeServiceImplBase {
    private static final Logger LOG = LoggerFactory.getLogger(GrpcService.class);

    private final NodeState state;
    private final ReplicationCoordinator coordinator;
    private final String logPrefix;

    public GrpcService(ReplicationCoordinator coordinator) {
        this.coordinator = coordinator;
        this.state = coordinator.getState();
        this.logPrefix = "[Node " + state.getNodeId() + "] ";
    }

    // client operations

    @Override
    public void submitMessage(SubmitRequest req, StreamObserver<SubmitReply> resp) {
        WriteResult result;
        try {
            result = coordinator.submit(req.getText(), req.getUser());
        } catch (ValidationException e) {
            resp.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
            return;
        }
        resp.onNext(result.toProto(state.getMode()));
        resp.onCompleted();
    }

    @Override
    public void listMessages(Empty e, StreamObserver<MessageList> resp) {
        List<Message> messages = coordinator.listMessages();
        MessageList.Builder b = MessageList.newBuilder()
                .setCount(messages.size())
                .setNodeId(state.getNodeId())
                .setMode(state.getMode().wireName())
                .setLocalOnly(true);
        messages.forEach(m -> b.addMessages(m.toProto()));
        resp.onNext(b.build());
        resp.onCompleted();
    }

    @Override
    public void health(Empty e, StreamObserver<HealthReply> resp) {
        resp.onNext(HealthReply.newBuilder()
                .setStatus("up")
                .setNodeId(state.getNodeId())
                .setMode(state.getMode().wireName())
                .setClusterSize(state.getClusterView().size())
                .setQuorumSize(state.getClusterView().quorumSize())
                .setStoredMessages(state.getStore().size())
                .build());
        resp.onCompleted();
    }

    // inter-node operations

    @Override
    public void replicate(ReplicateMsg msg, StreamObserver<ReplicateAck> resp) {
        try {
            boolean duplicate = coordinator.onReplicate(msg.getFromNode(), Message.of(msg.getMessage()));
            resp.onNext(ReplicateAck.newBuilder()
                    .setOk(true)
                    .setDuplicate(duplicate)
                    .setNodeId(state.getNodeId())
                    .build());
            resp.onCompleted();
        } catch (RuntimeException ex) {
            resp.onError(toStatus(msg.getFromNode(), "replicate", ex));
        }
    }

    @Override
    public void exchange(ExchangeMsg msg, StreamObserver<ExchangeReply> resp) {
        try {
            Transport.ExchangeResult result = coordinator.onExchange(msg.getFromNode(), Types.digestOf(msg.getDigest()));
            ExchangeReply.Builder b = ExchangeReply.newBuilder()
                    .setNodeId(result.nodeId())
                    .setDigest(Types.toDigest(result.remoteDigest()));
            result.missing().forEach(m -> b.addMissing(m.toProto()));
            resp.onNext(b.build());
            resp.onCompleted();
        } catch (RuntimeException ex) {
            resp.onError(toStatus(msg.getFromNode(), "exchange", ex));
        }
    }

    @Override
    public void push(PushMsg msg, StreamObserver<PushAck> resp) {
        try {
            List<Message> messages = new ArrayList<>(msg.getMessagesCount());
            for (MessageEntry e : msg.getMessagesList()) {
                messages.add(Message.of(e));
            }
            int merged = coordinator.onPush(msg.getFromNode(), messages);
            resp.onNext(PushAck.newBuilder().setMerged(merged).build());
            resp.onCompleted();
        } catch (RuntimeException ex) {
            resp.onError(toStatus(msg.getFromNode(), "push", ex));
        }
    }

    private RuntimeException toStatus(int fromNode, String call, RuntimeException ex) {
        if (ex instanceof ValidationException) {
            LOG.warn("{}{} from node {} malformed: {}", logPrefix, call, fromNode, ex.getMessage());
            return Status.INVALID_ARGUMENT.withDescription(ex.getMessage()).asRuntimeException();
        }
        if (ex instanceof TransportException) {
            TransportException te = (TransportException) ex;
            LOG.debug("{}{} from node {} refused: {}", logPrefix, call, fromNode, te.getMessage());
            Status status = te.getFailure() == TransportException.Failure.UNREACHABLE
                    ? Status.UNAVAILABLE
                    : Status.FAILED_PRECONDITION;
            return status.withDescription(te.getMessage()).asRuntimeException();
        }
        LOG.error("{}{} from node {} failed", logPrefix, call, fromNode, ex);
        return Status.INTERNAL.withDescription(ex.getMessage()).withCause(ex).asRuntimeException();
    }

    // admin

    @Override
    public void setLivePeers(LivePeers req, StreamObserver<Empty> resp) {
        Set<Integer> peers = new LinkedHashSet<>(req.getNodeIdsList());
        LOG.info("{}ADMIN setLivePeers -> {}", logPrefix, peers.isEmpty() ? "ALL" : peers);
        coordinator.setLivePeers(peers);
        resp.onNext(Empty.getDefaultInstance());
        resp.onCompleted();
    }

    @Override
    public void getAudit(Empty e, StreamObserver<AuditDump> resp) {
        AuditDump.Builder dump = AuditDump.newBuilder();
        for (MessageAudit.Entry en : state.getAudit().snapshot()) {
            dump.addEntries(AuditEntryDump.newBuilder()
                    .setTs(en.ts)
                    .setSelf(en.selfNodeId)
                    .setDir(en.dir.name())
                    .setKind(en.kind.name())
                    .setPeer(en.peerNodeId)
                    .setMessageId(en.messageId == null ? "" : en.messageId)
                    .setNote(en.note == null ? "" : en.note)
                    .build());
        }
        resp.onNext(dump.build());
        resp.onCompleted();
    }
}
