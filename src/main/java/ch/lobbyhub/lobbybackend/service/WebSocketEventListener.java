package ch.lobbyhub.lobbybackend.service;

import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.repository.PeerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.List;
import java.util.Optional;

/**
 * Tracks STOMP sessions as lobby peers.
 *
 * <p>On CONNECT the peer is registered from the native headers {@code username}
 * and {@code permissionLevel}; both are trusted as sent. On DISCONNECT the peer
 * leaves every lobby it joined.
 *
 * <p>{@code permissionLevel} comes from the client frame, so a gateway in front of
 * {@code /ws} must strip or overwrite it; otherwise any client can pass the
 * lobby creation permission check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketEventListener {

    static final String USERNAME_HEADER = "username";
    static final String PERMISSION_LEVEL_HEADER = "permissionLevel";

    private final PeerRegistry peerRegistry;
    private final LobbyCoordinationService coordinationService;

    @EventListener
    public void handleConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();

        if (sessionId == null) {
            return;
        }

        String username = firstHeader(accessor, USERNAME_HEADER).orElse(null);
        int permissionLevel = firstHeader(accessor, PERMISSION_LEVEL_HEADER)
                .map(value -> parsePermissionLevel(value, sessionId))
                .orElse(0);

        LobbyPeer peer = peerRegistry.register(sessionId, username, permissionLevel);
        log.info("Peer {} connected (session: {}, permission level: {})", peer, sessionId, permissionLevel);
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();

        Optional<LobbyPeer> peer = peerRegistry.remove(sessionId);
        if (peer.isEmpty()) {
            log.debug("Disconnect for untracked session: {}", sessionId);
            return;
        }

        coordinationService.handleDisconnect(peer.get());
        log.info("Peer {} disconnected (session: {})", peer.get(), sessionId);
    }

    private static Optional<String> firstHeader(StompHeaderAccessor accessor, String name) {
        List<String> values = accessor.getNativeHeader(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    private static int parsePermissionLevel(String value, String sessionId) {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            log.warn("Invalid permissionLevel header '{}' on session {}", value, sessionId);
            return 0;
        }
    }
}
