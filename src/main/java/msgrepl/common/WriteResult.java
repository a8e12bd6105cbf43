package msgrepl.common;

import msgrepl.common.Types.Message;
import msgrepl.proto.ReplProto.SubmitReply;

import java.util.Objects;

public final class WriteResult {

    public enum Outcome { COMMITTED, ACCEPTED, QUORUM_NOT_REACHED }

    private final Outcome outcome;
    private final Message message;
    private final int acks;
    private final int required;
    private final int clusterSize;

    private WriteResult(Outcome outcome, Message message, int acks, int required, int clusterSize) {
        this.outcome = Objects.requireNonNull(outcome);
        this.message = Objects.requireNonNull(message);
        this.acks = acks;
        this.required = required;
        this.clusterSize = clusterSize;
    }

    public static WriteResult committed(Message m, int acks, int required, int clusterSize) {
        return new WriteResult(Outcome.COMMITTED, m, acks, required, clusterSize);
    }

    public static WriteResult accepted(Message m, int clusterSize) {
        return new WriteResult(Outcome.ACCEPTED, m, 1, 1, clusterSize);
    }

    public static WriteResult quorumNotReached(Message m, int acks, int required, int clusterSize) {
        return new WriteResult(Outcome.QUORUM_NOT_REACHED, m, acks, required, clusterSize);
    }

    public Outcome getOutcome() { return outcome; }
    public Message getMessage() { return message; }
    public int getAcks() { return acks; }
    public int getRequired() { return required; }
    public int getClusterSize() { return clusterSize; }

    public boolean isSuccess() {
        return outcome != Outcome.QUORUM_NOT_REACHED;
    }

    public String detail() {
        switch (outcome) {
            case COMMITTED:
                return String.format("committed on %d/%d nodes", acks, clusterSize);
            case ACCEPTED:
                return "accepted locally, propagation in progress";
            default:
                return String.format("Only %d/%d nodes acknowledged the write, required %d for quorum.",
                        acks, clusterSize, required);
        }
    }

    public SubmitReply toProto(Types.Mode mode) {
        SubmitReply.Status status;
        switch (outcome) {
            case COMMITTED: status = SubmitReply.Status.COMMITTED; break;
            case ACCEPTED: status = SubmitReply.Status.ACCEPTED; break;
            default: status = SubmitReply.Status.QUORUM_NOT_REACHED;
        }
        SubmitReply.Builder b = SubmitReply.newBuilder()
                .setStatus(status)
                .setReplicas(acks)
                .setRequired(required)
                .setClusterSize(clusterSize)
                .setMode(mode.wireName())
                .setDetail(detail());
        // rejected writes are not visible anywhere, so no message is returned
        if (isSuccess()) b.setMessage(message.toProto());
        return b.build();
    }

    @Override public String toString() {
        return outcome + " " + message.getId() + " (" + detail() + ")";
    }
}
