package msgrepl.node;

import msgrepl.common.Types.Mode;
import msgrepl.common.WriteResult;

/**
 * Write path for one consistency protocol. Input has already been validated.
 */
public interface ReplicationStrategy {

    Mode mode();

    WriteResult submit(String text, String user);
}
