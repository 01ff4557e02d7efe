package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyMember;
import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.domain.LobbyUserContext;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyState;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.RoomAccessDto;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A pre-match room tracking members, properties and teams until a game starts.
 *
 * <p>The coordination service only talks to lobbies through this interface;
 * concrete rule sets are plugged in through {@link LobbyFactory} implementations.
 * Implementations serialize their own mutations, so every method may be called
 * from any request thread.
 */
public interface Lobby {

    int getId();

    /**
     * @return id of the factory that built this lobby
     */
    String getType();

    String getName();

    int getMaxPlayers();

    int getPlayerCount();

    /**
     * @return game server address, {@code null} until a game was provisioned
     */
    String getGameIp();

    /**
     * @return game server port, {@code 0} until a game was provisioned
     */
    int getGamePort();

    LobbyState getState();

    boolean isDestroyed();

    /**
     * @return when the lobby last became empty, empty while it has members
     */
    Optional<Instant> getEmptySince();

    Optional<LobbyMember> getMember(LobbyUserContext context);

    Optional<LobbyMember> getMemberByPeerId(int peerId);

    /**
     * Adds the connection as a member and records this lobby in its context.
     *
     * @throws ch.lobbyhub.lobbybackend.domain.LobbyException if the lobby is full, already
     *         started, the connection is already a member or reached its joined-lobbies limit
     */
    void addPlayer(LobbyUserContext context);

    /**
     * Removes the connection's member, if any, and clears the context's reference.
     * Calling it for a connection that is not a member is a no-op.
     */
    void removePlayer(LobbyUserContext context);

    /**
     * Sets a lobby-level property after the lobby's own validation.
     *
     * @return {@code false} if the setter may not change properties or the value is rejected
     */
    boolean setProperty(LobbyUserContext setter, String key, String value);

    /**
     * Sets a member-level property after the lobby's own validation.
     *
     * @return {@code false} if the value is rejected or the member does not belong to this lobby
     */
    boolean setPlayerProperty(LobbyMember member, String key, String value);

    void setReadyState(LobbyMember member, boolean ready);

    /**
     * Moves the member into the given team.
     *
     * @return {@code false} if the team does not exist, is full or switching is not allowed
     */
    boolean tryJoinTeam(String teamName, LobbyMember member);

    /**
     * Starts the game on behalf of the given connection.
     *
     * @throws ch.lobbyhub.lobbybackend.domain.LobbyException if the caller is not allowed to
     *         start, preconditions are not met or the game server could not be provisioned
     */
    void startGameManually(LobbyUserContext context);

    /**
     * @param requester connection the snapshot is generated for, may be {@code null}
     */
    LobbyDataDto generateLobbyData(LobbyUserContext requester);

    default LobbyDataDto generateLobbyData() {
        return generateLobbyData(null);
    }

    /**
     * @return lobby properties that may be shown in public game listings
     */
    Map<String, String> getPublicProperties(LobbyPeer requester);

    void chatMessageHandler(LobbyMember member, String message);

    /**
     * @throws ch.lobbyhub.lobbybackend.domain.LobbyException if the caller is not a member
     *         or no game is running
     */
    RoomAccessDto gameAccessRequestHandler(LobbyUserContext context);

    void addDestroyedListener(Consumer<Lobby> listener);

    void removeDestroyedListener(Consumer<Lobby> listener);

    /**
     * Moves the lobby to its terminal state and notifies destroyed listeners.
     * Only the first call has an effect.
     */
    void destroy();

    /**
     * Destroys the lobby if it has been empty since before the given instant.
     *
     * @return {@code true} if the lobby was destroyed by this call
     */
    boolean destroyIfEmptySince(Instant threshold);
}
