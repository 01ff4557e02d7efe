package ch.lobbyhub.lobbybackend.application.service;

import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.domain.LobbyException;
import ch.lobbyhub.lobbybackend.domain.LobbyMember;
import ch.lobbyhub.lobbybackend.domain.LobbyUserContext;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyEventType;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyState;
import ch.lobbyhub.lobbybackend.lobby.DeathmatchLobby;
import ch.lobbyhub.lobbybackend.lobby.DeathmatchLobbyFactory;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyChatMessageDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyEventDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyMemberDataDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static ch.lobbyhub.lobbybackend.testutil.LobbyTestUtils.GAME_SERVER;
import static ch.lobbyhub.lobbybackend.testutil.LobbyTestUtils.context;
import static ch.lobbyhub.lobbybackend.testutil.LobbyTestUtils.deathmatchLobby;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the shared lobby protocol in {@code BaseLobby}, exercised through
 * {@link DeathmatchLobby}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Membership rules and context bookkeeping</li>
 *   <li>Game master assignment and hand-over</li>
 *   <li>Property validation and permissions</li>
 *   <li>Ready system with automatic start</li>
 *   <li>Destruction and destroyed listeners</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class BaseLobbyTest {

    @Mock
    private LobbyEventPublisher publisher;

    @Mock
    private RoomSpawner spawner;

    private final LobbyUserContext alice = context(1, "Alice");
    private final LobbyUserContext bob = context(2, "Bob");
    private final LobbyUserContext carol = context(3, "Carol");

    private DeathmatchLobby lobby(LobbyConfig config) {
        return deathmatchLobby(0, config, publisher, spawner);
    }

    private DeathmatchLobby defaultLobby() {
        return lobby(LobbyConfig.builder().minPlayers(2).maxPlayers(4).numericPropertyKeys(Set.of("rounds")).build());
    }

    private static LobbyMember member(Lobby lobby, LobbyUserContext context) {
        return lobby.getMember(context).orElseThrow();
    }

    // ------------------------------------------------------------------------------------
    // addPlayer
    // ------------------------------------------------------------------------------------

    @Test
    void addPlayer_shouldAttachContext_andMakeFirstMemberGameMaster() {
        DeathmatchLobby lobby = defaultLobby();

        lobby.addPlayer(alice);
        lobby.addPlayer(bob);

        assertThat(lobby.getPlayerCount()).isEqualTo(2);
        assertThat(alice.getCurrentLobbyId()).contains(0);
        assertThat(bob.getCurrentLobbyId()).contains(0);
        assertThat(lobby.getGameMasterName()).contains("Alice");
        assertThat(lobby.getEmptySince()).isEmpty();
    }

    @Test
    void addPlayer_shouldThrowConflict_whenLobbyIsFull() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().maxPlayers(2).build());
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);

        LobbyException e = assertThrows(LobbyException.class, () -> lobby.addPlayer(carol));

        assertThat(e.getType()).isEqualTo(LobbyErrorType.CONFLICT);
        assertThat(e.getMessage()).isEqualTo("Lobby is full");
        assertThat(carol.getCurrentLobbyId()).isEmpty();
    }

    @Test
    void addPlayer_shouldThrowConflict_whenConnectionIsAlreadyMember() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);

        LobbyException e = assertThrows(LobbyException.class, () -> lobby.addPlayer(alice));

        assertThat(e.getMessage()).isEqualTo("You're already in this lobby");
        assertThat(lobby.getPlayerCount()).isEqualTo(1);
    }

    @Test
    void addPlayer_shouldLeaveLobbyUnchanged_whenContextIsAtItsLimit() {
        DeathmatchLobby lobby = defaultLobby();
        carol.tryAttach(99);

        LobbyException e = assertThrows(LobbyException.class, () -> lobby.addPlayer(carol));

        assertThat(e.getMessage()).isEqualTo("You're already in a lobby");
        assertThat(lobby.getPlayerCount()).isZero();
        assertThat(carol.getJoinedLobbyIds()).containsExactly(99);
    }

    @Test
    void addPlayer_shouldRejectJoins_afterGameStarted_unlessLiveJoiningIsAllowed() {
        LobbyConfig config = LobbyConfig.builder().enableReadySystem(false).build();
        DeathmatchLobby strict = lobby(config);
        DeathmatchLobby open = lobby(config.toBuilder().allowJoiningWhenGameIsLive(true).build());
        when(spawner.provision(any())).thenReturn(CompletableFuture.completedFuture(GAME_SERVER));

        strict.addPlayer(context(10, "Host"));
        strict.startGameManually(context(10, "Host"));
        open.addPlayer(context(11, "Host2"));
        open.startGameManually(context(11, "Host2"));

        LobbyException e = assertThrows(LobbyException.class, () -> strict.addPlayer(bob));
        open.addPlayer(carol);

        assertThat(e.getMessage()).isEqualTo("Game has already started");
        assertThat(open.getPlayerCount()).isEqualTo(2);
    }

    // ------------------------------------------------------------------------------------
    // removePlayer
    // ------------------------------------------------------------------------------------

    @Test
    void removePlayer_shouldBeIdempotent() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);

        lobby.removePlayer(bob);
        lobby.removePlayer(bob);
        lobby.removePlayer(carol);

        assertThat(lobby.getPlayerCount()).isEqualTo(1);
        assertThat(bob.getCurrentLobbyId()).isEmpty();
        verify(publisher, times(1)).publishEvent(argThat(event -> event.type() == LobbyEventType.MEMBER_LEFT));
    }

    @Test
    void removePlayer_shouldHandOverGameMaster_toLongestPresentMember() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);
        lobby.addPlayer(carol);

        lobby.removePlayer(alice);

        assertThat(lobby.getGameMasterName()).contains("Bob");
        verify(publisher).publishEvent(argThat(event ->
                event.type() == LobbyEventType.MASTER_CHANGED && "Bob".equals(event.payload().get("gameMaster"))));
    }

    @Test
    void removePlayer_shouldHandOverGameMaster_byJoinTime_notInsertionOrder() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);
        lobby.addPlayer(carol);
        Instant now = Instant.now();
        ReflectionTestUtils.setField(member(lobby, bob), "joinedAt", now.plusSeconds(60));
        ReflectionTestUtils.setField(member(lobby, carol), "joinedAt", now.minusSeconds(60));

        lobby.removePlayer(alice);

        assertThat(lobby.getGameMasterName()).contains("Carol");
    }

    @Test
    void removePlayer_shouldDestroyLobby_andNotifyListenersOnce_whenLastMemberLeaves() {
        DeathmatchLobby lobby = defaultLobby();
        List<Lobby> notified = new ArrayList<>();
        lobby.addDestroyedListener(notified::add);
        lobby.addPlayer(alice);

        lobby.removePlayer(alice);
        lobby.destroy();

        assertThat(lobby.isDestroyed()).isTrue();
        assertThat(lobby.getState()).isEqualTo(LobbyState.DESTROYED);
        assertThat(notified).containsExactly(lobby);
    }

    @Test
    void removePlayer_shouldRejectJoinRacingWithLastLeave() {
        AtomicReference<CompletableFuture<Void>> racingJoin = new AtomicReference<>();
        DeathmatchLobby lobby = new DeathmatchLobby(0, DeathmatchLobbyFactory.ID, "Race",
                LobbyConfig.builder().build(), publisher, spawner) {
            @Override
            protected boolean shouldDestroyWhenEmpty() {
                CompletableFuture<Void> join = CompletableFuture.runAsync(() -> addPlayer(bob));
                racingJoin.set(join);
                try {
                    join.get(200, TimeUnit.MILLISECONDS);
                } catch (TimeoutException | ExecutionException e) {
                    // join is waiting for the lobby lock or was already rejected
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return true;
            }
        };
        lobby.addPlayer(alice);

        lobby.removePlayer(alice);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> racingJoin.get().get(1, TimeUnit.SECONDS));
        assertThat(e.getCause()).isInstanceOf(LobbyException.class);
        assertThat(((LobbyException) e.getCause()).getType()).isEqualTo(LobbyErrorType.NOT_FOUND);
        assertThat(bob.getJoinedLobbyIds()).isEmpty();
        assertThat(lobby.isDestroyed()).isTrue();
        assertThat(lobby.getPlayerCount()).isZero();
    }

    @Test
    void removeDestroyedListener_shouldStopNotifications() {
        DeathmatchLobby lobby = defaultLobby();
        List<Lobby> notified = new ArrayList<>();
        Consumer<Lobby> listener = notified::add;
        lobby.addDestroyedListener(listener);
        lobby.removeDestroyedListener(listener);

        lobby.destroy();

        assertThat(notified).isEmpty();
    }

    @Test
    void destroy_shouldReleaseGameServer_whenGameWasRunning() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().enableReadySystem(false).build());
        when(spawner.provision(any())).thenReturn(CompletableFuture.completedFuture(GAME_SERVER));
        lobby.addPlayer(alice);
        lobby.startGameManually(alice);

        lobby.destroy();

        verify(spawner).release(GAME_SERVER);
        assertThat(lobby.getPlayerCount()).isZero();
    }

    @Test
    void addPlayer_shouldThrowNotFound_afterDestroy() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.destroy();

        LobbyException e = assertThrows(LobbyException.class, () -> lobby.addPlayer(alice));

        assertThat(e.getType()).isEqualTo(LobbyErrorType.NOT_FOUND);
    }

    @Test
    void destroyIfEmptySince_shouldOnlyDestroyLobbiesEmptyBeforeThreshold() {
        DeathmatchLobby abandoned = defaultLobby();
        DeathmatchLobby occupied = defaultLobby();
        occupied.addPlayer(alice);

        assertThat(abandoned.destroyIfEmptySince(Instant.now().minusSeconds(60))).isFalse();
        assertThat(occupied.destroyIfEmptySince(Instant.now().plusSeconds(60))).isFalse();
        assertThat(abandoned.destroyIfEmptySince(Instant.now().plusSeconds(60))).isTrue();
        assertThat(abandoned.isDestroyed()).isTrue();
        assertThat(occupied.isDestroyed()).isFalse();
    }

    // ------------------------------------------------------------------------------------
    // Properties
    // ------------------------------------------------------------------------------------

    @Test
    void setProperty_shouldOnlyAcceptGameMaster_byDefault() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);

        assertThat(lobby.setProperty(bob, "map", "arena")).isFalse();
        assertThat(lobby.setProperty(carol, "map", "arena")).isFalse();
        assertThat(lobby.setProperty(alice, "map", "arena")).isTrue();
        assertThat(lobby.getProperty("map")).contains("arena");
        verify(publisher).publishEvent(argThat(event -> event.type() == LobbyEventType.PROPERTY_CHANGED));
    }

    @Test
    void setProperty_shouldAcceptAnyMember_whenPlayersMayChangeProperties() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().allowPlayersChangeLobbyProperties(true).build());
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);

        assertThat(lobby.setProperty(bob, "map", "desert")).isTrue();
    }

    @Test
    void setProperty_shouldValidateNumericKeysAndValueLength() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);

        assertThat(lobby.setProperty(alice, "rounds", "ten")).isFalse();
        assertThat(lobby.setProperty(alice, "rounds", "10")).isTrue();
        assertThat(lobby.setProperty(alice, "rounds", "0")).isFalse();
        assertThat(lobby.setProperty(alice, "timeLimit", "61")).isFalse();
        assertThat(lobby.setProperty(alice, "motd", "x".repeat(257))).isFalse();
        assertThat(lobby.setProperty(alice, " ", "value")).isFalse();
        assertThat(lobby.getProperty("rounds")).contains("10");
    }

    @Test
    void getPublicProperties_shouldHidePrivateKeys() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().privatePropertyKeys(Set.of("password")).build());
        lobby.addPlayer(alice);
        lobby.setProperty(alice, "map", "arena");
        lobby.setProperty(alice, "password", "hunter2");

        assertThat(lobby.getPublicProperties(null)).containsOnlyKeys("map");
        assertThat(lobby.generateLobbyData().properties()).containsKeys("map", "password");
    }

    @Test
    void setPlayerProperty_shouldRejectForeignMembers() {
        DeathmatchLobby lobby = defaultLobby();
        DeathmatchLobby other = defaultLobby();
        lobby.addPlayer(alice);
        other.addPlayer(bob);

        assertThat(lobby.setPlayerProperty(member(lobby, alice), "color", "red")).isTrue();
        assertThat(lobby.setPlayerProperty(member(other, bob), "color", "blue")).isFalse();
        assertThat(member(lobby, alice).getProperty("color")).isEqualTo("red");
    }

    // ------------------------------------------------------------------------------------
    // Ready system
    // ------------------------------------------------------------------------------------

    @Test
    void setReadyState_shouldStartGameAutomatically_whenEveryoneIsReady() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().minPlayers(2).startGameWhenAllReady(true).build());
        when(spawner.provision(any())).thenReturn(CompletableFuture.completedFuture(GAME_SERVER));
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);

        lobby.setReadyState(member(lobby, alice), true);
        assertThat(lobby.getState()).isEqualTo(LobbyState.FORMING);

        lobby.setReadyState(member(lobby, bob), true);
        assertThat(lobby.getState()).isEqualTo(LobbyState.IN_PROGRESS);
        assertThat(lobby.getGameIp()).isEqualTo("10.0.0.5");
        assertThat(lobby.getGamePort()).isEqualTo(7777);
    }

    @Test
    void setReadyState_shouldStayForming_whenAutomaticStartFails() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().minPlayers(1).startGameWhenAllReady(true).build());
        when(spawner.provision(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("No free game server available")));
        lobby.addPlayer(alice);

        lobby.setReadyState(member(lobby, alice), true);

        assertThat(lobby.getState()).isEqualTo(LobbyState.FORMING);
        assertThat(member(lobby, alice).isReady()).isTrue();
    }

    @Test
    void setReadyState_shouldNotStart_whenBelowMinimumPlayers() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().minPlayers(2).startGameWhenAllReady(true).build());
        lobby.addPlayer(alice);

        lobby.setReadyState(member(lobby, alice), true);

        assertThat(lobby.getState()).isEqualTo(LobbyState.FORMING);
        verify(spawner, never()).provision(any());
    }

    // ------------------------------------------------------------------------------------
    // Snapshots and chat
    // ------------------------------------------------------------------------------------

    @Test
    void generateLobbyData_shouldDescribeLobby_andPersonaliseForRequester() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);
        lobby.setReadyState(member(lobby, bob), true);

        LobbyDataDto data = lobby.generateLobbyData(bob);

        assertThat(data.lobbyId()).isZero();
        assertThat(data.lobbyType()).isEqualTo("deathmatch");
        assertThat(data.state()).isEqualTo(LobbyState.FORMING);
        assertThat(data.gameMaster()).isEqualTo("Alice");
        assertThat(data.maxPlayers()).isEqualTo(4);
        assertThat(data.playerCount()).isEqualTo(2);
        assertThat(data.members()).extracting(LobbyMemberDataDto::username).containsExactly("Alice", "Bob");
        assertThat(data.members()).extracting(LobbyMemberDataDto::ready).containsExactly(false, true);
        assertThat(data.teams()).isEmpty();
        assertThat(data.currentUsername()).isEqualTo("Bob");
    }

    @Test
    void chatMessageHandler_shouldTruncateLongMessages_andIgnoreBlankOnes() {
        DeathmatchLobby lobby = lobby(LobbyConfig.builder().maxChatMessageLength(5).build());
        lobby.addPlayer(alice);

        lobby.chatMessageHandler(member(lobby, alice), "   ");
        lobby.chatMessageHandler(member(lobby, alice), "hello world");

        ArgumentCaptor<LobbyChatMessageDto> captor = ArgumentCaptor.forClass(LobbyChatMessageDto.class);
        verify(publisher).publishChatMessage(captor.capture());
        assertThat(captor.getValue().message()).isEqualTo("hello");
    }

    @Test
    void chatMessageHandler_shouldDropMessages_fromFormerMembers() {
        DeathmatchLobby lobby = defaultLobby();
        lobby.addPlayer(alice);
        lobby.addPlayer(bob);
        LobbyMember former = member(lobby, bob);
        lobby.removePlayer(bob);

        lobby.chatMessageHandler(former, "still here?");

        verify(publisher, never()).publishChatMessage(any());
    }

    @Test
    void events_shouldCarryLobbyIdAndState() {
        DeathmatchLobby lobby = defaultLobby();

        lobby.addPlayer(alice);

        ArgumentCaptor<LobbyEventDto> captor = ArgumentCaptor.forClass(LobbyEventDto.class);
        verify(publisher, atLeastOnce()).publishEvent(captor.capture());
        LobbyEventDto joined = captor.getAllValues().get(0);
        assertThat(joined.type()).isEqualTo(LobbyEventType.MEMBER_JOINED);
        assertThat(joined.lobbyId()).isZero();
        assertThat(joined.lobbyState()).isEqualTo(LobbyState.FORMING);
        assertThat(joined.timeStamp()).isNotNull();
    }
}
