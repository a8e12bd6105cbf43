package msgrepl.node;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import msgrepl.common.Types.Mode;
import msgrepl.rpc.GrpcService;
import msgrepl.rpc.GrpcTransport;
import msgrepl.rpc.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * One cluster node: gRPC server, outbound transport, replication coordinator and,
 * in gossip mode, the anti-entropy scheduler.
 * <pre>
 *   java -DnodeId=1 -Dport=50051 -Dmode=gossip \
 *        -Dpeer.1=localhost:50051 -Dpeer.2=localhost:50052 -Dpeer.3=localhost:50053 \
 *        msgrepl.node.NodeServer
 * </pre>
 */
public class NodeServer {
    private static final Logger LOG = LoggerFactory.getLogger(NodeServer.class);

    private final NodeState state;
    private final ServerBuilder<?> serverBuilder;
    private final Function<NodeState, Transport> transportFactory;
    private final ExecutorService threadPool;

    private Server grpcServer;
    private Transport transport;
    private ReplicationCoordinator coordinator;
    private GossipScheduler gossipScheduler;

    public NodeServer(NodeConfig cfg) {
        this(cfg, ServerBuilder.forPort(cfg.getPort()), GrpcTransport::connect);
    }

    public NodeServer(NodeConfig cfg, ServerBuilder<?> serverBuilder, Function<NodeState, Transport> transportFactory) {
        this.state = new NodeState(cfg);
        this.serverBuilder = serverBuilder;
        this.transportFactory = transportFactory;
        this.threadPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "repl-worker-" + cfg.getNodeId());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() throws IOException {
        NodeConfig cfg = state.getNodeConfig();
        transport = transportFactory.apply(state);
        coordinator = new ReplicationCoordinator(state, transport, threadPool);

        if (cfg.getMode() == Mode.GOSSIP) {
            gossipScheduler = new GossipScheduler(state, coordinator.gossipStrategy(), threadPool);
        }

        grpcServer = serverBuilder
                .addService(new GrpcService(coordinator))
                .build()
                .start();

        if (gossipScheduler != null) {
            gossipScheduler.start();
        }

        LOG.info("Node {} up @ {} mode={} cluster={} quorum={}/{}",
                cfg.getNodeId(), cfg.getPort(), cfg.getMode().wireName(),
                state.getClusterView().members(), state.getClusterView().quorumSize(), state.getClusterView().size());
    }

    public synchronized void stop() {
        if (gossipScheduler != null) {
            gossipScheduler.close();
        }
        if (grpcServer != null) {
            try {
                grpcServer.shutdown().awaitTermination(3, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                grpcServer.shutdownNow();
            }
        }
        if (transport != null) {
            transport.close();
        }
        threadPool.shutdownNow();
        LOG.info("Node {} stopped", state.getNodeId());
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (grpcServer != null) grpcServer.awaitTermination();
    }

    public NodeState getState() {
        return state;
    }

    public ReplicationCoordinator getCoordinator() {
        return coordinator;
    }

    public GossipScheduler getGossipScheduler() {
        return gossipScheduler;
    }

    public static void main(String[] args) throws Exception {
        NodeConfig cfg = NodeConfig.fromSystemProperties();
        LOG.info("Starting {}", cfg);
        NodeServer ns = new NodeServer(cfg);
        ns.start();
        Runtime.getRuntime().addShutdownHook(new Thread(ns::stop, "shutdown-" + cfg.getNodeId()));
        ns.blockUntilShutdown();
    }
}
