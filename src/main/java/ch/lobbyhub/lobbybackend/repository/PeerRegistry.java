package ch.lobbyhub.lobbybackend.repository;

import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connected STOMP sessions and the peers they authenticated as.
 */
@Component
@Slf4j
public class PeerRegistry {

    private final Map<String, LobbyPeer> peersBySession = new ConcurrentHashMap<>();
    private final AtomicInteger nextPeerId = new AtomicInteger(1);

    /**
     * Registers a session. Registering the same session again returns the existing peer.
     */
    public LobbyPeer register(String sessionId, String username, int permissionLevel) {
        return peersBySession.computeIfAbsent(sessionId, id -> {
            int peerId = nextPeerId.getAndIncrement();
            String name = username == null || username.isBlank() ? "Guest-" + peerId : username.strip();
            log.debug("Registered peer {}#{} for session {}", name, peerId, sessionId);
            return new LobbyPeer(peerId, sessionId, name, permissionLevel);
        });
    }

    public Optional<LobbyPeer> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(peersBySession.get(sessionId));
    }

    public Optional<LobbyPeer> remove(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(peersBySession.remove(sessionId));
    }

    public int count() {
        return peersBySession.size();
    }
}
