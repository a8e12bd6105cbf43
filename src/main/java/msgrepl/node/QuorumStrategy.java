package msgrepl.node;

import msgrepl.common.MessageAudit;
import msgrepl.common.Types.Message;
import msgrepl.common.Types.Mode;
import msgrepl.common.Types.WriteState;
import msgrepl.common.WriteResult;
import msgrepl.rpc.Transport;
import msgrepl.rpc.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Synchronous majority replication. The coordinator's own vote counts as the first
 * ack; every allowed peer is sent the message concurrently and the write resolves as
 * soon as a quorum has acked or a quorum can no longer be reached.
 * <p>
 * The local store only receives the message once the write is committed, so a
 * rejected write is never visible on the coordinator. A peer that reports the id as
 * already held does not count towards the quorum: a fresh proposal can only be a
 * duplicate if its id collides with a different message.
 */
public final class QuorumStrategy implements ReplicationStrategy {
    private static final Logger LOG = LoggerFactory.getLogger(QuorumStrategy.class);
    private static final long WRITE_DEADLINE_GRACE_MS = Long.getLong("quorumGraceMs", 200L);

    private final NodeState state;
    private final Transport transport;
    private final ExecutorService pool;
    private final long rpcTimeoutMs;
    private final Clock clock;
    private final long incarnation;
    private final AtomicLong versions;
    private final String logPrefix;

    public QuorumStrategy(NodeState state, Transport transport, ExecutorService pool, Clock clock) {
        this.state = state;
        this.transport = transport;
        this.pool = pool;
        this.rpcTimeoutMs = state.getNodeConfig().getRpcTimeoutMs();
        this.clock = clock;
        this.incarnation = state.getIncarnation();
        this.versions = new AtomicLong(state.getStore().highestVersion(state.getNodeId(), incarnation).orElse(0L));
        this.logPrefix = "[Quorum " + state.getNodeId() + "] ";
    }

    @Override
    public Mode mode() {
        return Mode.QUORUM;
    }

    private void log(String fmt, Object... args) {
        if (LOG.isDebugEnabled()) {
            LOG.debug(logPrefix + String.format(fmt, args));
        }
    }

    @Override
    public WriteResult submit(String text, String user) {
        Message proposal = new Message(state.getNodeId(), incarnation, versions.incrementAndGet(), text, user, clock.millis());
        return replicate(proposal);
    }

    WriteResult replicate(Message proposal) {
        final ClusterView view = state.getClusterView();
        final int quorum = view.quorumSize();
        final int clusterSize = view.size();
        final MessageAudit audit = state.getAudit();
        final AtomicReference<WriteState> outcome = new AtomicReference<>(WriteState.PROPOSING);

        log("PROPOSING %s quorum=%d/%d", proposal.getId(), quorum, clusterSize);
        audit.log(MessageAudit.Dir.RECV, MessageAudit.Kind.SUBMIT, null, proposal.getId(), "quorum");

        List<Integer> targets = view.peers().stream()
                .filter(state::isPeerAllowed)
                .collect(Collectors.toList());

        int possibleAcks = 1 + targets.size();
        if (possibleAcks < quorum) {
            log("REJECTED %s without fan-out: possible=%d < quorum=%d", proposal.getId(), possibleAcks, quorum);
            outcome.set(WriteState.REJECTED);
            return reject(proposal, 1, quorum, clusterSize);
        }
        if (quorum <= 1) {
            outcome.set(WriteState.COMMITTED);
            return commit(proposal, 1, quorum, clusterSize);
        }

        final AtomicInteger acks = new AtomicInteger(1);
        final AtomicInteger remainingPossible = new AtomicInteger(targets.size());
        final CountDownLatch done = new CountDownLatch(1);
        outcome.set(WriteState.COLLECTING);

        log("COLLECTING %s targets=%s", proposal.getId(), targets);
        for (int peerId : targets) {
            pool.submit(() -> {
                // calls already sent stay in flight; only unsent ones are dropped after a rejection
                if (outcome.get() == WriteState.REJECTED) {
                    remainingPossible.decrementAndGet();
                    return;
                }
                boolean acked = false;
                try {
                    audit.log(MessageAudit.Dir.SENT, MessageAudit.Kind.REPLICATE, peerId, proposal.getId(), null);
                    Transport.ReplicateAck ack = transport.replicate(peerId, proposal);
                    state.notePeerReachable(peerId, true);
                    if (ack.duplicate()) {
                        audit.log(MessageAudit.Dir.RECV, MessageAudit.Kind.NACK, peerId, proposal.getId(), "duplicate id");
                        LOG.warn("{}peer={} already holds {}, not counted", logPrefix, peerId, proposal.getId());
                    } else {
                        acked = true;
                        audit.log(MessageAudit.Dir.RECV, MessageAudit.Kind.ACK, peerId, proposal.getId(), null);
                    }
                } catch (TransportException ex) {
                    state.notePeerReachable(peerId, ex.getFailure() == TransportException.Failure.REJECTED);
                    audit.log(MessageAudit.Dir.RECV, MessageAudit.Kind.NACK, peerId, proposal.getId(), ex.getFailure().name());
                    log("REPLICATE %s to peer=%d failed: %s", proposal.getId(), peerId, ex.getMessage());
                } catch (RuntimeException ex) {
                    audit.log(MessageAudit.Dir.RECV, MessageAudit.Kind.NACK, peerId, proposal.getId(), "ERROR");
                    LOG.warn("{}REPLICATE {} to peer={} failed unexpectedly", logPrefix, proposal.getId(), peerId, ex);
                }

                if (acked) {
                    int count = acks.incrementAndGet();
                    log("ACK %s from peer=%d count=%d", proposal.getId(), peerId, count);
                    if (count >= quorum && outcome.compareAndSet(WriteState.COLLECTING, WriteState.COMMITTED)) {
                        done.countDown();
                    }
                }
                int rem = remainingPossible.decrementAndGet();
                if (acks.get() + rem < quorum && outcome.compareAndSet(WriteState.COLLECTING, WriteState.REJECTED)) {
                    done.countDown();
                }
            });
        }

        try {
            if (!done.await(rpcTimeoutMs + WRITE_DEADLINE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                if (outcome.compareAndSet(WriteState.COLLECTING, WriteState.REJECTED)) {
                    log("write deadline passed for %s (acks=%d/%d)", proposal.getId(), acks.get(), quorum);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            outcome.compareAndSet(WriteState.COLLECTING, WriteState.REJECTED);
        }

        if (outcome.get() == WriteState.COMMITTED) {
            return commit(proposal, acks.get(), quorum, clusterSize);
        }
        return reject(proposal, acks.get(), quorum, clusterSize);
    }

    private WriteResult commit(Message m, int acks, int quorum, int clusterSize) {
        state.getStore().append(m);
        state.getAudit().log(MessageAudit.Dir.SENT, MessageAudit.Kind.COMMIT, null, m.getId(), acks + "/" + clusterSize);
        log("COMMITTED %s acks=%d quorum=%d", m.getId(), acks, quorum);
        return WriteResult.committed(m, Math.min(acks, clusterSize), quorum, clusterSize);
    }

    private WriteResult reject(Message m, int acks, int quorum, int clusterSize) {
        state.getAudit().log(MessageAudit.Dir.SENT, MessageAudit.Kind.REJECT, null, m.getId(), acks + "/" + clusterSize);
        LOG.warn("{}quorum not reached for {}: acks={} required={} cluster={}",
                logPrefix, m.getId(), acks, quorum, clusterSize);
        return WriteResult.quorumNotReached(m, acks, quorum, clusterSize);
    }
}
