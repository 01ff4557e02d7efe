package ch.lobbyhub.lobbybackend.domain;

import ch.lobbyhub.lobbybackend.web.api.dto.LobbyMemberDataDto;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Participation record of one connection inside one lobby.
 *
 * <p>The member refers back to its connection by peer id only, so it never keeps
 * a disconnected client alive. Mutations happen under the owning lobby's lock;
 * fields are volatile and the property map is copied on read because member
 * data may also be rendered from request threads that do not hold that lock.
 */
@Getter
public class LobbyMember {

    private final int peerId;

    private final String username;

    private final Instant joinedAt;

    @Setter
    private volatile boolean ready;

    /**
     * Name of the team this member belongs to, {@code null} in lobbies without teams.
     */
    @Setter
    private volatile String team;

    private volatile Map<String, String> properties = Map.of();

    public LobbyMember(int peerId, String username) {
        this.peerId = peerId;
        this.username = username;
        this.joinedAt = Instant.now();
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public void setProperty(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(properties);
        updated.put(key, value);
        this.properties = Map.copyOf(updated);
    }

    public LobbyMemberDataDto generateDataPacket() {
        return new LobbyMemberDataDto(peerId, username, properties, ready, team);
    }
}
