package msgrepl.node;

import msgrepl.common.Types.Message;
import msgrepl.common.Types.Mode;
import msgrepl.common.ValidationException;
import msgrepl.common.WriteResult;
import msgrepl.rpc.Transport;
import msgrepl.rpc.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplicationCoordinatorTest {

    private TestCluster cluster;

    @AfterEach
    void tearDown() {
        if (cluster != null) cluster.close();
    }

    @Test
    void rejectsBlankText() {
        cluster = new TestCluster(3, Mode.QUORUM);
        ReplicationCoordinator c = cluster.node(1).coordinator;

        assertThatThrownBy(() -> c.submit("   ", "alice")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> c.submit(null, "alice")).isInstanceOf(ValidationException.class);
        assertThat(cluster.network.deliveredTo(2)).isZero();
    }

    @Test
    void rejectsOverLongInput() {
        cluster = new TestCluster(1, Mode.GOSSIP);
        ReplicationCoordinator c = cluster.node(1).coordinator;

        assertThatThrownBy(() -> c.submit("x".repeat(ReplicationCoordinator.MAX_TEXT_LENGTH + 1), "alice"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> c.submit("ok", "u".repeat(ReplicationCoordinator.MAX_USER_LENGTH + 1)))
                .isInstanceOf(ValidationException.class);
        assertThat(c.listMessages()).isEmpty();
    }

    @Test
    void missingUserFallsBackToDefault() {
        cluster = new TestCluster(1, Mode.GOSSIP);

        WriteResult r = cluster.node(1).coordinator.submit("hi", " ");

        assertThat(r.getMessage().getUser()).isEqualTo(ReplicationCoordinator.DEFAULT_USER);
    }

    @Test
    void picksTheStrategyOfTheConfiguredMode() {
        cluster = new TestCluster(2, Mode.QUORUM);

        assertThat(cluster.node(1).coordinator.mode()).isEqualTo(Mode.QUORUM);
        assertThatThrownBy(() -> cluster.node(1).coordinator.gossipStrategy())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void refusesTrafficFromNonMembers() {
        cluster = new TestCluster(2, Mode.GOSSIP);
        Message m = new Message(9, 1L, 1, "intruder", "x", 1L);

        assertThatThrownBy(() -> cluster.node(1).coordinator.onReplicate(9, m))
                .isInstanceOf(TransportException.class)
                .extracting(e -> ((TransportException) e).getFailure())
                .isEqualTo(TransportException.Failure.REJECTED);
        assertThat(cluster.node(1).store().size()).isZero();
    }

    @Test
    void filteredPeerLooksUnreachable() {
        cluster = new TestCluster(3, Mode.GOSSIP);
        cluster.node(1).state.setLivePeerIds(Set.of(1, 2));

        assertThatThrownBy(() -> cluster.node(1).coordinator.onPush(3, List.of(new Message(3, 1L, 1, "t", "u", 1L))))
                .isInstanceOf(TransportException.class)
                .extracting(e -> ((TransportException) e).getFailure())
                .isEqualTo(TransportException.Failure.UNREACHABLE);
        assertThat(cluster.node(1).store().size()).isZero();
    }

    @Test
    void exchangeAnswersWithDigestAndMissingMessages() {
        cluster = new TestCluster(2, Mode.GOSSIP);
        cluster.node(1).coordinator.submit("a", "u");
        cluster.node(1).coordinator.submit("b", "u");

        Transport.ExchangeResult reply = cluster.node(1).coordinator.onExchange(2, Map.of("1-1", 1L));

        assertThat(reply.nodeId()).isEqualTo(1);
        assertThat(reply.remoteDigest()).isEqualTo(Map.of("1-1", 2L));
        assertThat(reply.missing()).extracting(Message::getId).containsExactly("1-1-2");
    }
}
