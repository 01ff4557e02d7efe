package ch.lobbyhub.lobbybackend.repository;

import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.domain.LobbyUserContext;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lobby contexts of connected peers, created lazily on first lobby request.
 */
public class LobbyUserContextRegistry {

    private final Map<Integer, LobbyUserContext> contexts = new ConcurrentHashMap<>();
    private final int joinedLobbiesLimit;

    public LobbyUserContextRegistry(int joinedLobbiesLimit) {
        this.joinedLobbiesLimit = joinedLobbiesLimit;
    }

    public LobbyUserContext getOrCreate(LobbyPeer peer) {
        return contexts.computeIfAbsent(peer.getPeerId(), id -> new LobbyUserContext(peer, joinedLobbiesLimit));
    }

    public Optional<LobbyUserContext> find(int peerId) {
        return Optional.ofNullable(contexts.get(peerId));
    }

    public Optional<LobbyUserContext> remove(int peerId) {
        return Optional.ofNullable(contexts.remove(peerId));
    }

    /**
     * Drops the given lobby from every context still referencing it.
     */
    public void detachFromLobby(int lobbyId) {
        contexts.values().forEach(context -> context.detach(lobbyId));
    }

    public int size() {
        return contexts.size();
    }

    public void clear() {
        contexts.clear();
    }
}
