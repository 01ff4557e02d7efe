package ch.lobbyhub.lobbybackend.application.service;

import ch.lobbyhub.lobbybackend.domain.LobbyUserContext;
import org.junit.jupiter.api.Test;

import static ch.lobbyhub.lobbybackend.testutil.LobbyTestUtils.peer;
import static org.assertj.core.api.Assertions.assertThat;

class LobbyUserContextTest {

    @Test
    void tryAttach_shouldRespectJoinedLobbiesLimit() {
        LobbyUserContext context = new LobbyUserContext(peer(1, "Alice"), 1);

        assertThat(context.tryAttach(3)).isTrue();
        assertThat(context.tryAttach(4)).isFalse();
        assertThat(context.hasCapacity()).isFalse();
        assertThat(context.getCurrentLobbyId()).contains(3);
    }

    @Test
    void tryAttach_shouldRejectSameLobbyTwice() {
        LobbyUserContext context = new LobbyUserContext(peer(1, "Alice"), 3);

        assertThat(context.tryAttach(3)).isTrue();
        assertThat(context.tryAttach(3)).isFalse();
        assertThat(context.getJoinedLobbyIds()).containsExactly(3);
    }

    @Test
    void getCurrentLobbyId_shouldReturnMostRecentlyJoinedLobby() {
        LobbyUserContext context = new LobbyUserContext(peer(1, "Alice"), 3);
        context.tryAttach(1);
        context.tryAttach(2);

        assertThat(context.getCurrentLobbyId()).contains(2);

        context.detach(2);
        context.detach(99);

        assertThat(context.getCurrentLobbyId()).contains(1);
        assertThat(context.isInLobby(2)).isFalse();
    }

    @Test
    void constructor_shouldClampLimitToAtLeastOne() {
        LobbyUserContext context = new LobbyUserContext(peer(1, "Alice"), 0);

        assertThat(context.getJoinedLobbiesLimit()).isEqualTo(1);
        assertThat(context.getCurrentLobbyId()).isEmpty();
    }
}
