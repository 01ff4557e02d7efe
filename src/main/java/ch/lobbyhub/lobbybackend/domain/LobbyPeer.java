package ch.lobbyhub.lobbybackend.domain;

import lombok.Getter;

/**
 * Identity of one connected client.
 *
 * <p>Created when a STOMP session connects and dropped when it disconnects.
 * The permission level is assigned upstream and trusted as-is.
 */
@Getter
public class LobbyPeer {

    /**
     * Numeric id used by clients to address other members (e.g. member data requests).
     */
    private final int peerId;

    /**
     * STOMP session this peer is bound to.
     */
    private final String sessionId;

    private final String username;

    private final int permissionLevel;

    public LobbyPeer(int peerId, String sessionId, String username, int permissionLevel) {
        this.peerId = peerId;
        this.sessionId = sessionId;
        this.username = username;
        this.permissionLevel = permissionLevel;
    }

    @Override
    public String toString() {
        return username + "#" + peerId;
    }
}
