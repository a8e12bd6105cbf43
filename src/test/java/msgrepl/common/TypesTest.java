package msgrepl.common;

import msgrepl.common.Types.Message;
import msgrepl.proto.ReplProto.MessageEntry;
import msgrepl.proto.ReplProto.SubmitReply;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypesTest {

    @Test
    void wireEntryMustMatchItsIdentity() {
        MessageEntry good = new Message(3, 42L, 7, "t", "u", 5L).toProto();
        MessageEntry forged = good.toBuilder().setId("3-42-8").build();

        assertThat(Message.of(good).getId()).isEqualTo("3-42-7");
        assertThat(Message.of(good).getStreamKey()).isEqualTo("3-42");
        assertThatThrownBy(() -> Message.of(forged)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Message.of(good.toBuilder().setIncarnation(43L).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Message.of(good.toBuilder().setIncarnation(0L).setId("").build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Message.of(good.toBuilder().setVersion(0).setId("").build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectedWriteReplyCarriesNoMessage() {
        Message m = new Message(1, 1L, 1, "t", "u", 1L);

        SubmitReply rejected = WriteResult.quorumNotReached(m, 1, 2, 3).toProto(Types.Mode.QUORUM);
        SubmitReply committed = WriteResult.committed(m, 2, 2, 3).toProto(Types.Mode.QUORUM);

        assertThat(rejected.getStatus()).isEqualTo(SubmitReply.Status.QUORUM_NOT_REACHED);
        assertThat(rejected.hasMessage()).isFalse();
        assertThat(rejected.getDetail()).contains("Only 1/3");
        assertThat(committed.getMessage().getId()).isEqualTo("1-1-1");
        assertThat(committed.getMode()).isEqualTo("quorum");
    }
}
