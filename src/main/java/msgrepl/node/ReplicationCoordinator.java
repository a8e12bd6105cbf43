package msgrepl.node;

import msgrepl.common.MessageAudit;
import msgrepl.common.Types.Message;
import msgrepl.common.Types.Mode;
import msgrepl.common.ValidationException;
import msgrepl.common.WriteResult;
import msgrepl.rpc.ReplicaEndpoint;
import msgrepl.rpc.Transport;
import msgrepl.rpc.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point of a node's replication core. Client writes are validated here and
 * handed to the strategy of the configured mode; calls from peers are served here
 * for both modes.
 */
public final class ReplicationCoordinator implements ReplicaEndpoint {
    private static final Logger LOG = LoggerFactory.getLogger(ReplicationCoordinator.class);

    public static final String DEFAULT_USER = "anonymous";
    static final int MAX_TEXT_LENGTH = Integer.getInteger("maxTextLength", 4096);
    static final int MAX_USER_LENGTH = 64;

    private final NodeState state;
    private final ReplicationStrategy strategy;
    private final GossipStrategy gossip;
    private final ExecutorService pool;

    public ReplicationCoordinator(NodeState state, Transport transport, ExecutorService pool) {
        this(state, transport, pool, Clock.systemUTC());
    }

    public ReplicationCoordinator(NodeState state, Transport transport, ExecutorService pool, Clock clock) {
        this.state = state;
        this.pool = pool;
        if (state.getMode() == Mode.GOSSIP) {
            this.gossip = new GossipStrategy(state, transport, clock);
            this.strategy = gossip;
        } else {
            this.gossip = null;
            this.strategy = new QuorumStrategy(state, transport, pool, clock);
        }
    }

    public NodeState getState() {
        return state;
    }

    public Mode mode() {
        return strategy.mode();
    }

    /** Present only in gossip mode. */
    public GossipStrategy gossipStrategy() {
        if (gossip == null) {
            throw new IllegalStateException("node " + state.getNodeId() + " runs in " + mode().wireName() + " mode");
        }
        return gossip;
    }

    /**
     * @throws ValidationException for blank or over-long text, or an over-long user
     */
    public WriteResult submit(String text, String user) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("text is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException("text longer than " + MAX_TEXT_LENGTH + " characters");
        }
        String who = (user == null || user.isBlank()) ? DEFAULT_USER : user.trim();
        if (who.length() > MAX_USER_LENGTH) {
            throw new ValidationException("user longer than " + MAX_USER_LENGTH + " characters");
        }
        WriteResult result = strategy.submit(text, who);
        LOG.info("[Node {}] {}", state.getNodeId(), result);
        return result;
    }

    /** Local contents only, which may lag other nodes. */
    public List<Message> listMessages() {
        return state.getStore().listAll();
    }

    /**
     * Applies the operator's live-peer filter. In gossip mode every peer that became
     * reachable through the change is exchanged with right away on the worker pool
     * rather than at its next random round.
     *
     * @return completes once those exchanges have finished; failed ones are left to
     *         the regular rounds
     */
    public CompletableFuture<Void> setLivePeers(Set<Integer> peers) {
        Set<Integer> newlyReachable = state.setLivePeerIds(peers);
        LOG.info("[Node {}] live peers -> {} newlyReachable={}",
                state.getNodeId(), peers == null || peers.isEmpty() ? "ALL" : peers, newlyReachable);
        if (gossip == null || !state.isSelfAllowed()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] catchUp = newlyReachable.stream()
                .filter(state.getClusterView()::isMember)
                .map(peerId -> CompletableFuture.runAsync(() -> catchUp(peerId), pool))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(catchUp);
    }

    private void catchUp(int peerId) {
        try {
            GossipStrategy.ExchangeOutcome out = gossip.exchangeWith(peerId);
            LOG.info("[Node {}] caught up with peer {} pulled={} pushed={}",
                    state.getNodeId(), peerId, out.pulled(), out.pushed());
        } catch (TransportException e) {
            state.notePeerReachable(peerId, e.getFailure() == TransportException.Failure.REJECTED);
            LOG.debug("[Node {}] catch-up with peer {} left to the next round: {}",
                    state.getNodeId(), peerId, e.getMessage());
        }
    }

    private void checkInbound(int fromNode) {
        if (!state.getClusterView().isMember(fromNode)) {
            throw new TransportException(fromNode, TransportException.Failure.REJECTED,
                    "node " + fromNode + " is not a cluster member");
        }
        if (!state.isPeerAllowed(fromNode)) {
            throw new TransportException(fromNode, TransportException.Failure.UNREACHABLE,
                    "node " + state.getNodeId() + " does not accept traffic from " + fromNode);
        }
    }

    @Override
    public boolean onReplicate(int fromNode, Message message) {
        checkInbound(fromNode);
        boolean added = state.getStore().append(message);
        state.getAudit().log(MessageAudit.Dir.RECV, MessageAudit.Kind.REPLICATE, fromNode, message.getId(),
                added ? null : "duplicate");
        return !added;
    }

    @Override
    public Transport.ExchangeResult onExchange(int fromNode, Map<String, Long> remoteDigest) {
        checkInbound(fromNode);
        MessageStore store = state.getStore();
        Map<String, Long> digest = store.digest();
        List<Message> missing = store.missingFrom(remoteDigest);
        state.getAudit().log(MessageAudit.Dir.RECV, MessageAudit.Kind.EXCHANGE, fromNode, null,
                "sending=" + missing.size());
        return new Transport.ExchangeResult(state.getNodeId(), digest, missing);
    }

    @Override
    public int onPush(int fromNode, List<Message> messages) {
        checkInbound(fromNode);
        int merged = state.getStore().appendAll(new ArrayList<>(messages));
        state.getAudit().log(MessageAudit.Dir.RECV, MessageAudit.Kind.PUSH, fromNode, null, "merged=" + merged);
        if (merged > 0) {
            LOG.info("[Node {}] merged {} pushed messages from peer {}", state.getNodeId(), merged, fromNode);
        }
        return merged;
    }
}
