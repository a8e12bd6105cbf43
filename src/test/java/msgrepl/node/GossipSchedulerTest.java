package msgrepl.node;

import msgrepl.common.Types.Mode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GossipSchedulerTest {

    private TestCluster cluster;

    @AfterEach
    void tearDown() {
        if (cluster != null) cluster.close();
    }

    @Test
    void startAndCloseControlTheTimer() throws Exception {
        cluster = new TestCluster(2, Mode.GOSSIP);
        GossipScheduler scheduler = cluster.node(1).scheduler;
        assertThat(scheduler.isRunning()).isFalse();

        scheduler.start();
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(TestCluster.eventually(() -> scheduler.roundsCompleted() >= 2, 2000)).isTrue();

        scheduler.close();
        assertThat(scheduler.isRunning()).isFalse();
        long after = scheduler.roundsCompleted();
        Thread.sleep(200);
        assertThat(scheduler.roundsCompleted()).isEqualTo(after);
    }

    @Test
    void backgroundRoundsSpreadWritesToEveryNode() throws Exception {
        cluster = new TestCluster(3, Mode.GOSSIP);
        cluster.node(2).coordinator.submit("spread", "b");
        cluster.node(3).coordinator.submit("spread too", "c");

        cluster.nodes().forEach(n -> n.scheduler.start());

        assertThat(TestCluster.eventually(() -> cluster.converged() && cluster.node(1).store().size() == 2, 5000))
                .isTrue();
    }

    @Test
    void selectsAllAllowedPeersWhenFanoutCoversThem() {
        cluster = new TestCluster(4, Mode.GOSSIP, 800L, 0);

        assertThat(cluster.node(1).scheduler.selectPeers()).containsExactly(2, 3, 4);

        cluster.node(1).state.setLivePeerIds(Set.of(1, 3));
        assertThat(cluster.node(1).scheduler.selectPeers()).containsExactly(3);
    }

    @Test
    void selectsFanoutDistinctRandomPeers() {
        cluster = new TestCluster(5, Mode.GOSSIP, 800L, 2);
        Set<Integer> seen = new HashSet<>();

        for (int i = 0; i < 200; i++) {
            List<Integer> picked = cluster.node(1).scheduler.selectPeers();
            assertThat(picked).hasSize(2).doesNotHaveDuplicates().doesNotContain(1);
            seen.addAll(picked);
        }

        assertThat(seen).containsExactlyInAnyOrder(2, 3, 4, 5);
    }

    @Test
    void excludedNodeSkipsRounds() {
        cluster = new TestCluster(3, Mode.GOSSIP, 800L, 0);
        cluster.node(1).coordinator.submit("stay here", "a");
        cluster.node(1).state.setLivePeerIds(Set.of(2, 3));

        GossipScheduler.RoundStats stats = cluster.node(1).scheduler.runRound();

        assertThat(stats.contacted()).isZero();
        assertThat(cluster.node(1).scheduler.selectPeers()).isEmpty();
        assertThat(cluster.network.deliveredTo(2)).isZero();
    }
}
