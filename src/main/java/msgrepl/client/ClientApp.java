package msgrepl.client;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import msgrepl.proto.ReplProto.AuditEntryDump;
import msgrepl.proto.ReplProto.MessageEntry;
import msgrepl.proto.ReplProto.MessageList;
import msgrepl.proto.ReplProto.SubmitReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.Set;
import java.util.TreeMap;

/**
 * Console client. Connects to every node named by {@code -Dpeer.<id>=host:port} and
 * either runs the command given on the command line or reads commands from stdin.
 */
public class ClientApp implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ClientApp.class);

    private static final long CLIENT_TIMEOUT = Long.getLong("clientTimeoutMs", 3000L);
    private static final String USAGE =
            "Commands: post <node> <user> <text...> | list [node] | health [node] | audit [node] | live <id,id,...|all> | exit";

    private final ClusterCoordinator cluster;
    private final PrintStream out;
    private final JsonFormat.Printer json = JsonFormat.printer().includingDefaultValueFields();

    ClientApp(ClusterCoordinator cluster, PrintStream out) {
        this.cluster = cluster;
        this.out = out;
    }

    @Override
    public void close() {
        cluster.close();
    }

    /**
     * Runs one command line.
     *
     * @return false when the user asked to exit
     */
    boolean execute(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) return true;
        String[] parts = trimmed.split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);
        try {
            switch (cmd) {
                case "exit":
                case "quit":
                    return false;
                case "post":
                    if (parts.length < 4) {
                        out.println("Usage: post <node> <user> <text...>");
                        break;
                    }
                    post(Integer.parseInt(parts[1]), parts[2], String.join(" ", Arrays.copyOfRange(parts, 3, parts.length)));
                    break;
                case "list":
                    forNodes(parts, this::printMessages);
                    break;
                case "health":
                    forNodes(parts, id -> out.println(toJson(cluster.health(id))));
                    break;
                case "audit":
                    forNodes(parts, this::printAudit);
                    break;
                case "live":
                    if (parts.length < 2) {
                        out.println("Usage: live <id,id,...|all>");
                        break;
                    }
                    applyLiveNodes(parts[1]);
                    break;
                default:
                    out.println(USAGE);
            }
        } catch (NumberFormatException nfe) {
            out.println("Node ids must be integers: " + nfe.getMessage());
        } catch (IllegalArgumentException iae) {
            out.println(iae.getMessage());
        } catch (StatusRuntimeException sre) {
            out.println(describe(sre));
        }
        return true;
    }

    private void post(int nodeId, String user, String text) {
        SubmitReply reply = cluster.submit(nodeId, user, text);
        switch (reply.getStatus()) {
            case COMMITTED:
                out.printf("committed %s on %d/%d nodes%n",
                        reply.getMessage().getId(), reply.getReplicas(), reply.getClusterSize());
                break;
            case ACCEPTED:
                out.printf("accepted %s by node %d, propagation in progress%n", reply.getMessage().getId(), nodeId);
                break;
            case QUORUM_NOT_REACHED:
                out.println("write quorum failed: " + reply.getDetail());
                break;
            default:
                out.println(toJson(reply));
        }
    }

    private void printMessages(int nodeId) {
        MessageList list = cluster.list(nodeId);
        out.printf("node %d (%s, local view) holds %d messages%n", list.getNodeId(), list.getMode(), list.getCount());
        for (MessageEntry m : list.getMessagesList()) {
            out.printf("  %-8s %-12s %s%n", m.getId(), m.getUser(), m.getText());
        }
    }

    private void printAudit(int nodeId) {
        List<AuditEntryDump> entries = cluster.audit(nodeId).getEntriesList();
        out.printf("node %d audit (%d entries)%n", nodeId, entries.size());
        for (AuditEntryDump e : entries) {
            out.printf("  %d %-4s %-9s peer=%-3d %-8s %s%n",
                    e.getTs(), e.getDir(), e.getKind(), e.getPeer(), e.getMessageId(), e.getNote());
        }
    }

    private void applyLiveNodes(String arg) {
        Set<Integer> live = new LinkedHashSet<>();
        if (!arg.equalsIgnoreCase("all")) {
            for (String tok : arg.split(",")) {
                if (!tok.isBlank()) live.add(Integer.parseInt(tok.trim()));
            }
        }
        List<Integer> failed = cluster.setLiveNodes(live);
        out.println("live nodes -> " + (live.isEmpty() ? "ALL" : live)
                + (failed.isEmpty() ? "" : " (unreachable: " + failed + ")"));
    }

    private interface NodeAction {
        void run(int nodeId);
    }

    private void forNodes(String[] parts, NodeAction action) {
        if (parts.length >= 2) {
            action.run(Integer.parseInt(parts[1]));
            return;
        }
        for (int id : cluster.nodeIds()) {
            try {
                action.run(id);
            } catch (StatusRuntimeException sre) {
                out.printf("node %d: %s%n", id, describe(sre));
            }
        }
    }

    private static String describe(StatusRuntimeException sre) {
        Status st = sre.getStatus();
        if (st.getCode() == Status.Code.INVALID_ARGUMENT) {
            return "rejected: " + st.getDescription();
        }
        return "request failed: " + st.getCode() + (st.getDescription() == null ? "" : " " + st.getDescription());
    }

    private String toJson(MessageOrBuilder msg) {
        try {
            return json.print(msg);
        } catch (InvalidProtocolBufferException e) {
            LOG.warn("could not render {} as json", msg.getClass().getSimpleName(), e);
            return msg.toString();
        }
    }

    void repl(Scanner in) {
        while (true) {
            out.print("> ");
            final String line;
            try {
                line = in.nextLine();
            } catch (NoSuchElementException eof) {
                return;
            }
            if (!execute(line)) return;
        }
    }

    static Map<Integer, String> targetsFromSystemProperties() {
        Map<Integer, String> targets = new TreeMap<>();
        System.getProperties().forEach((k, v) -> {
            String ks = String.valueOf(k);
            if (ks.startsWith("peer.")) {
                targets.put(Integer.parseInt(ks.substring("peer.".length())), String.valueOf(v).trim());
            }
        });
        return targets;
    }

    public static void main(String[] args) {
        try (ClientApp app = new ClientApp(ClusterCoordinator.connect(targetsFromSystemProperties(), CLIENT_TIMEOUT), System.out)) {
            if (args.length > 0) {
                app.execute(String.join(" ", args));
            } else {
                app.out.println(USAGE);
                app.repl(new Scanner(System.in));
            }
        }
    }
}
