package msgrepl.node;

import msgrepl.common.MessageAudit;
import msgrepl.common.Types.Message;
import msgrepl.common.Types.Mode;
import msgrepl.common.WriteResult;
import msgrepl.rpc.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Local-first writes with anti-entropy propagation.
 * <p>
 * A submit only touches the local store. {@link #exchangeWith(int)} is one push-pull
 * session with a peer:
 * <ol>
 *   <li>send our per-stream digest to the peer,</li>
 *   <li>merge whatever the peer holds above it and read the peer's digest from the reply,</li>
 *   <li>push back whatever we hold above the peer's digest.</li>
 * </ol>
 * Merging is deduplicated, so sessions can be repeated or interleaved freely.
 */
public final class GossipStrategy implements ReplicationStrategy {
    private static final Logger LOG = LoggerFactory.getLogger(GossipStrategy.class);

    private final NodeState state;
    private final Transport transport;
    private final Clock clock;
    private final String logPrefix;

    public record ExchangeOutcome(int peerId, int pulled, int pushed) {}

    public GossipStrategy(NodeState state, Transport transport, Clock clock) {
        this.state = state;
        this.transport = transport;
        this.clock = clock;
        this.logPrefix = "[Gossip " + state.getNodeId() + "] ";
    }

    @Override
    public Mode mode() {
        return Mode.GOSSIP;
    }

    @Override
    public WriteResult submit(String text, String user) {
        Message m = state.getStore().appendLocal(state.getNodeId(), state.getIncarnation(), text, user, clock.millis());
        state.getAudit().log(MessageAudit.Dir.RECV, MessageAudit.Kind.SUBMIT, null, m.getId(), "gossip");
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}ACCEPTED {} locally", logPrefix, m.getId());
        }
        return WriteResult.accepted(m, state.getClusterView().size());
    }

    /**
     * Runs one push-pull session. Transport failures propagate to the caller, which
     * treats them as "try again next round".
     */
    public ExchangeOutcome exchangeWith(int peerId) {
        MessageStore store = state.getStore();
        MessageAudit audit = state.getAudit();

        Map<String, Long> localDigest = store.digest();
        audit.log(MessageAudit.Dir.SENT, MessageAudit.Kind.EXCHANGE, peerId, null, localDigest.toString());
        Transport.ExchangeResult reply = transport.exchange(peerId, localDigest);
        state.notePeerReachable(peerId, true);

        int pulled = store.appendAll(reply.missing());
        if (pulled > 0) {
            audit.log(MessageAudit.Dir.RECV, MessageAudit.Kind.MERGE, peerId, null, "pulled=" + pulled);
            LOG.info("{}merged {} messages from peer {}", logPrefix, pulled, peerId);
        }

        List<Message> theirMissing = store.missingFrom(reply.remoteDigest());
        int pushed = 0;
        if (!theirMissing.isEmpty()) {
            audit.log(MessageAudit.Dir.SENT, MessageAudit.Kind.PUSH, peerId, null, "count=" + theirMissing.size());
            pushed = transport.push(peerId, theirMissing);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}exchange with peer={} pulled={} pushed={}/{}", logPrefix, peerId, pulled, pushed, theirMissing.size());
        }
        return new ExchangeOutcome(peerId, pulled, pushed);
    }
}
