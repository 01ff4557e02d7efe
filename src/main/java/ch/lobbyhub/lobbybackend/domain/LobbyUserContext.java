package ch.lobbyhub.lobbybackend.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lobby-related state of a single connection.
 *
 * <p>Only lobby ids are stored: the context never owns a lobby, lookups go
 * through the lobby registry. The most recently joined lobby is the
 * "current" one used by member-scoped requests (ready, team, chat, start).
 *
 * <p>Lobbies attach and detach themselves while holding their own lock, so
 * every method synchronizes on the context. This keeps the joined-lobbies
 * limit intact when two lobbies accept the same connection concurrently.
 */
public class LobbyUserContext {

    private final LobbyPeer peer;
    private final int joinedLobbiesLimit;
    private final Set<Integer> joinedLobbyIds = new LinkedHashSet<>();

    public LobbyUserContext(LobbyPeer peer, int joinedLobbiesLimit) {
        this.peer = peer;
        this.joinedLobbiesLimit = Math.max(1, joinedLobbiesLimit);
    }

    public LobbyPeer getPeer() {
        return peer;
    }

    public int getPeerId() {
        return peer.getPeerId();
    }

    public String getUsername() {
        return peer.getUsername();
    }

    public int getJoinedLobbiesLimit() {
        return joinedLobbiesLimit;
    }

    /**
     * @return id of the most recently joined lobby, if any
     */
    public synchronized Optional<Integer> getCurrentLobbyId() {
        Integer current = null;
        for (Integer id : joinedLobbyIds) {
            current = id;
        }
        return Optional.ofNullable(current);
    }

    public synchronized List<Integer> getJoinedLobbyIds() {
        return new ArrayList<>(joinedLobbyIds);
    }

    public synchronized boolean isInLobby(int lobbyId) {
        return joinedLobbyIds.contains(lobbyId);
    }

    public synchronized boolean hasCapacity() {
        return joinedLobbyIds.size() < joinedLobbiesLimit;
    }

    /**
     * Records membership in the given lobby.
     *
     * @return {@code false} if already attached to that lobby or the limit is reached
     */
    public synchronized boolean tryAttach(int lobbyId) {
        if (joinedLobbyIds.contains(lobbyId) || joinedLobbyIds.size() >= joinedLobbiesLimit) {
            return false;
        }
        joinedLobbyIds.add(lobbyId);
        return true;
    }

    /**
     * Forgets the given lobby. Unknown ids are ignored.
     */
    public synchronized void detach(int lobbyId) {
        joinedLobbyIds.remove(lobbyId);
    }
}
