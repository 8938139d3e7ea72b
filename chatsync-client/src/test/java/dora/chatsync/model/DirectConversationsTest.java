package dora.chatsync.model;

import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectConversationsTest {

    @Property
    void idDoesNotDependOnParticipantOrder(@ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 12) String a,
                                           @ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 12) String b) {
        assertThat(DirectConversations.idFor(a, b)).isEqualTo(DirectConversations.idFor(b, a));
    }

    @Property
    void peerOfRecoversTheOtherParticipant(@ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 12) String me,
                                           @ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 12) String peer) {
        String id = DirectConversations.idFor(me, peer);

        assertThat(DirectConversations.peerOf(id, me)).isEqualTo(peer);
    }

    @Example
    void smallerIdComesFirst() {
        assertThat(DirectConversations.idFor("u2", "u1")).isEqualTo("u1:u2");
    }

    @Example
    void conversationWithYourselfHasYouAsPeer() {
        assertThat(DirectConversations.peerOf("u1:u1", "u1")).isEqualTo("u1");
    }

    @Example
    void malformedIdIsRejected() {
        assertThatThrownBy(() -> DirectConversations.peerOf("u1", "u1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DirectConversations.peerOf("u1:", "u1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void outsiderIsRejected() {
        assertThatThrownBy(() -> DirectConversations.peerOf("u1:u2", "u3"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("u3");
    }
}
