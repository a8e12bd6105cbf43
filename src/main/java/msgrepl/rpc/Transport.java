package msgrepl.rpc;

import msgrepl.common.Types.Message;

import java.util.List;
import java.util.Map;

/**
 * Outbound calls from one node to its peers. Every call is bounded by the
 * implementation's per-call timeout and either returns a positive answer or throws
 * {@link TransportException}.
 */
public interface Transport extends AutoCloseable {

    record ReplicateAck(int nodeId, boolean duplicate) {}

    /**
     * @param remoteDigest highest version per stream held by the peer
     * @param missing      messages the peer holds above the caller's digest
     */
    record ExchangeResult(int nodeId, Map<String, Long> remoteDigest, List<Message> missing) {}

    ReplicateAck replicate(int peerId, Message message);

    /** Sends the local digest and pulls what the peer has that the caller lacks. */
    ExchangeResult exchange(int peerId, Map<String, Long> localDigest);

    /** Sends messages the peer lacks; returns how many were new to it. */
    int push(int peerId, List<Message> messages);

    @Override
    void close();
}
