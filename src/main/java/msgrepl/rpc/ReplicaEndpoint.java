package msgrepl.rpc;

import msgrepl.common.Types.Message;

import java.util.List;
import java.util.Map;

/**
 * Receiving side of {@link Transport}: what a node does when a peer calls it.
 * Implementations throw {@link TransportException} with {@code UNREACHABLE} when
 * the caller is filtered out.
 */
public interface ReplicaEndpoint {

    /** @return true if the message was already stored */
    boolean onReplicate(int fromNode, Message message);

    Transport.ExchangeResult onExchange(int fromNode, Map<String, Long> remoteDigest);

    int onPush(int fromNode, List<Message> messages);
}
