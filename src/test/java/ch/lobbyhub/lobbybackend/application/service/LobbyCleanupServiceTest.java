package ch.lobbyhub.lobbybackend.application.service;

import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.lobby.DeathmatchLobby;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.service.LobbyCleanupService;
import ch.lobbyhub.lobbybackend.service.LobbyCoordinationService;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;

import static ch.lobbyhub.lobbybackend.testutil.LobbyTestUtils.context;
import static ch.lobbyhub.lobbybackend.testutil.LobbyTestUtils.deathmatchLobby;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link LobbyCleanupService}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Destruction of lobbies empty for longer than the TTL</li>
 *   <li>Preservation of occupied and recently emptied lobbies</li>
 * </ul>
 *
 * <p>Notes:
 * <ul>
 *   <li>Scheduled execution is not tested (Spring scheduling framework responsibility)</li>
 *   <li>Uses ReflectionTestUtils to set @Value properties for testing</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class LobbyCleanupServiceTest {

    @Mock
    private LobbyCoordinationService coordinationService;

    @Mock
    private LobbyEventPublisher publisher;

    @Mock
    private RoomSpawner spawner;

    @InjectMocks
    private LobbyCleanupService cleanupService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(cleanupService, "emptyTtlSeconds", 300L);
        ReflectionTestUtils.setField(cleanupService, "cleanupIntervalMs", 60000L);
    }

    @Test
    void triggerCleanup_shouldDestroyOnlyLobbiesEmptyPastTtl() {
        Lobby stale = mock(Lobby.class);
        Lobby fresh = mock(Lobby.class);
        when(stale.destroyIfEmptySince(any(Instant.class))).thenReturn(true);
        when(fresh.destroyIfEmptySince(any(Instant.class))).thenReturn(false);
        when(coordinationService.getLobbies()).thenReturn(List.of(stale, fresh));

        int destroyed = cleanupService.triggerCleanup();

        assertThat(destroyed).isEqualTo(1);
    }

    @Test
    void triggerCleanup_shouldKeepOccupiedLobby() {
        DeathmatchLobby lobby = deathmatchLobby(0, LobbyConfig.builder().build(), publisher, spawner);
        lobby.addPlayer(context(1, "Alice"));
        ReflectionTestUtils.setField(cleanupService, "emptyTtlSeconds", 0L);
        when(coordinationService.getLobbies()).thenReturn(List.of(lobby));

        int destroyed = cleanupService.triggerCleanup();

        assertThat(destroyed).isZero();
        assertThat(lobby.isDestroyed()).isFalse();
    }

    @Test
    void triggerCleanup_shouldKeepLobbyEmptyForLessThanTtl() {
        DeathmatchLobby lobby = deathmatchLobby(0, LobbyConfig.builder().build(), publisher, spawner);
        when(coordinationService.getLobbies()).thenReturn(List.of(lobby));

        int destroyed = cleanupService.triggerCleanup();

        assertThat(destroyed).isZero();
        assertThat(lobby.isDestroyed()).isFalse();
    }

    @Test
    void triggerCleanup_shouldDestroyNeverJoinedLobby_onceTtlElapsed() {
        DeathmatchLobby lobby = deathmatchLobby(0, LobbyConfig.builder().build(), publisher, spawner);
        ReflectionTestUtils.setField(cleanupService, "emptyTtlSeconds", -1L);
        when(coordinationService.getLobbies()).thenReturn(List.of(lobby));

        int destroyed = cleanupService.triggerCleanup();

        assertThat(destroyed).isEqualTo(1);
        assertThat(lobby.isDestroyed()).isTrue();
        verify(spawner, never()).release(any());
    }

    @Test
    void destroyAbandonedLobbies_shouldRunSweep() {
        when(coordinationService.getLobbies()).thenReturn(List.of());

        cleanupService.destroyAbandonedLobbies();

        verify(coordinationService).getLobbies();
    }
}
