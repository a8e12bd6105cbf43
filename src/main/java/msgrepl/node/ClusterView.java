package msgrepl.node;

import java.util.List;
import java.util.Optional;

/**
 * What a node knows about cluster membership. Membership is fixed at boot; an
 * implementation backed by a membership protocol would plug in here.
 */
public interface ClusterView {

    int selfId();

    /** All members including self, ascending by id. */
    List<Integer> members();

    /** All members except self, ascending by id. */
    List<Integer> peers();

    Optional<String> addressOf(int nodeId);

    default int size() {
        return members().size();
    }

    default int quorumSize() {
        return size() / 2 + 1;
    }

    default boolean isMember(int nodeId) {
        return members().contains(nodeId);
    }
}
