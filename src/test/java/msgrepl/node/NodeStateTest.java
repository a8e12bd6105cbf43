package msgrepl.node;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeStateTest {

    private static NodeState node(int self, int size) {
        NodeConfig.Builder b = NodeConfig.builder(self);
        for (int id = 1; id <= size; id++) {
            b.peer(id, "h" + id + ":1");
        }
        return new NodeState(b.build());
    }

    @Test
    void clusterViewDerivesQuorumFromMembership() {
        StaticClusterView three = new StaticClusterView(2, Map.of(3, "c", 1, "a", 2, "b"));
        StaticClusterView four = new StaticClusterView(1, Map.of(1, "a", 2, "b", 3, "c", 4, "d"));

        assertThat(three.members()).containsExactly(1, 2, 3);
        assertThat(three.peers()).containsExactly(1, 3);
        assertThat(three.quorumSize()).isEqualTo(2);
        assertThat(four.quorumSize()).isEqualTo(3);
        assertThat(three.isMember(3)).isTrue();
        assertThat(three.isMember(7)).isFalse();
        assertThat(three.addressOf(1)).hasValue("a");
        assertThat(three.addressOf(9)).isEmpty();
    }

    @Test
    void clusterViewMustContainSelf() {
        assertThatThrownBy(() -> new StaticClusterView(5, Map.of(1, "a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyFilterAllowsEveryone() {
        NodeState s = node(1, 3);

        assertThat(s.isSelfAllowed()).isTrue();
        assertThat(s.isPeerAllowed(2)).isTrue();
        assertThat(s.isPeerAllowed(3)).isTrue();
    }

    @Test
    void filterRestrictsPeersAndReportsNewlyEnabledOnes() {
        NodeState s = node(1, 3);

        assertThat(s.setLivePeerIds(Set.of(1, 2))).isEmpty();
        assertThat(s.isPeerAllowed(2)).isTrue();
        assertThat(s.isPeerAllowed(3)).isFalse();

        assertThat(s.setLivePeerIds(Set.of())).containsExactly(3);
        assertThat(s.isPeerAllowed(3)).isTrue();
    }

    @Test
    void nodeLeftOutOfTheFilterTalksToNobody() {
        NodeState s = node(1, 3);

        s.setLivePeerIds(Set.of(2, 3));

        assertThat(s.isSelfAllowed()).isFalse();
        assertThat(s.isPeerAllowed(2)).isFalse();
        assertThat(s.setLivePeerIds(null)).containsExactlyInAnyOrder(2, 3);
    }

    @Test
    void remembersLastObservedReachability() {
        NodeState s = node(1, 3);
        s.notePeerReachable(2, false);
        s.notePeerReachable(2, true);
        s.notePeerReachable(3, false);

        assertThat(s.observedReachability()).isEqualTo(Map.of(2, true, 3, false));
    }
}
