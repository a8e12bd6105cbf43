package msgrepl.node;

import msgrepl.rpc.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Periodic anti-entropy driver for one node. Rounds run at a fixed rate on a
 * dedicated timer thread between {@link #start()} and {@link #close()}; each
 * round exchanges with {@code gossipFanout} random peers in parallel. Tests call
 * {@link #runRound()} directly instead of starting the timer.
 */
public final class GossipScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GossipScheduler.class);

    public record RoundStats(long round, int contacted, int succeeded, int pulled, int pushed) {}

    private final NodeState state;
    private final GossipStrategy gossip;
    private final ExecutorService pool;
    private final long intervalMs;
    private final int fanout;
    private final long exchangeTimeoutMs;
    private final String logPrefix;

    private final SplittableRandom random;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong rounds = new AtomicLong(0);

    public GossipScheduler(NodeState state, GossipStrategy gossip, ExecutorService pool) {
        this.state = state;
        this.gossip = gossip;
        this.pool = pool;
        this.intervalMs = state.getNodeConfig().getGossipIntervalMs();
        this.fanout = state.getNodeConfig().getGossipFanout();
        // exchange + push, each bounded by the per-call timeout
        this.exchangeTimeoutMs = 2 * state.getNodeConfig().getRpcTimeoutMs() + 100L;
        this.logPrefix = "[Gossip " + state.getNodeId() + "] ";
        this.random = new SplittableRandom(Objects.hash(state.getNodeId(), System.nanoTime()));

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gossip-timer-" + state.getNodeId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thr, ex) ->
                    LOG.error("{}gossip timer thread died", logPrefix, ex));
            return t;
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, MILLISECONDS);
        LOG.info("{}scheduler started interval={}ms fanout={} peers={}",
                logPrefix, intervalMs, fanout <= 0 ? "all" : fanout, state.getClusterView().peers());
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                LOG.warn("{}gossip timer did not stop in time", logPrefix);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        if (started.get()) {
            LOG.info("{}scheduler stopped after {} rounds", logPrefix, rounds.get());
        }
    }

    public boolean isRunning() {
        return started.get() && !scheduler.isShutdown();
    }

    public long roundsCompleted() {
        return rounds.get();
    }

    // exceptions would cancel the fixed-rate task, keep the timer alive
    private void tick() {
        try {
            runRound();
        } catch (RuntimeException ex) {
            LOG.error("{}gossip round failed", logPrefix, ex);
        }
    }

    /**
     * One anti-entropy round. A failed exchange with one peer is logged and does not
     * affect the others.
     */
    public RoundStats runRound() {
        long round = rounds.incrementAndGet();
        if (!state.isSelfAllowed()) {
            return new RoundStats(round, 0, 0, 0, 0);
        }
        List<Integer> targets = selectPeers();
        if (targets.isEmpty()) {
            return new RoundStats(round, 0, 0, 0, 0);
        }

        List<CompletableFuture<GossipStrategy.ExchangeOutcome>> inFlight = new ArrayList<>(targets.size());
        for (int peerId : targets) {
            inFlight.add(CompletableFuture.supplyAsync(() -> gossip.exchangeWith(peerId), pool));
        }

        int succeeded = 0, pulled = 0, pushed = 0;
        for (int i = 0; i < inFlight.size(); i++) {
            int peerId = targets.get(i);
            try {
                GossipStrategy.ExchangeOutcome out = inFlight.get(i).get(exchangeTimeoutMs, MILLISECONDS);
                succeeded++;
                pulled += out.pulled();
                pushed += out.pushed();
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (cause instanceof TransportException) {
                    TransportException te = (TransportException) cause;
                    state.notePeerReachable(peerId, te.getFailure() == TransportException.Failure.REJECTED);
                    LOG.debug("{}round {} exchange with peer={} deferred: {}", logPrefix, round, peerId, te.getMessage());
                } else {
                    LOG.warn("{}round {} exchange with peer={} failed", logPrefix, round, peerId, cause);
                }
            } catch (TimeoutException te) {
                inFlight.get(i).cancel(true);
                state.notePeerReachable(peerId, false);
                LOG.debug("{}round {} exchange with peer={} timed out", logPrefix, round, peerId);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        RoundStats stats = new RoundStats(round, targets.size(), succeeded, pulled, pushed);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}round {} done {}", logPrefix, round, stats);
        }
        return stats;
    }

    synchronized List<Integer> selectPeers() {
        List<Integer> candidates = state.getClusterView().peers().stream()
                .filter(state::isPeerAllowed)
                .collect(Collectors.toCollection(ArrayList::new));
        if (fanout <= 0 || fanout >= candidates.size()) {
            return candidates;
        }
        // partial Fisher-Yates
        for (int i = 0; i < fanout; i++) {
            int j = i + random.nextInt(candidates.size() - i);
            Integer tmp = candidates.get(i);
            candidates.set(i, candidates.get(j));
            candidates.set(j, tmp);
        }
        return new ArrayList<>(candidates.subList(0, fanout));
    }
}
