package ch.lobbyhub.lobbybackend.service;

import ch.lobbyhub.lobbybackend.lobby.Lobby;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Periodically destroys lobbies that have stayed empty for too long.
 *
 * <p>Lobbies destroy themselves when their last member leaves, so this sweep only
 * catches lobbies that never had a member, e.g. when the creator could not
 * join the lobby it created.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code lobbies.cleanup.interval-ms}: how often the sweep runs (default: 1 minute)</li>
 *   <li>{@code lobbies.cleanup.empty-ttl-seconds}: how long a lobby may stay empty (default: 5 minutes)</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Getter
public class LobbyCleanupService {

    private final LobbyCoordinationService coordinationService;

    @Value("${lobbies.cleanup.interval-ms:60000}")
    private long cleanupIntervalMs;

    @Value("${lobbies.cleanup.empty-ttl-seconds:300}")
    private long emptyTtlSeconds;

    @Scheduled(fixedRateString = "${lobbies.cleanup.interval-ms:60000}")
    public void destroyAbandonedLobbies() {
        triggerCleanup();
    }

    /**
     * Runs the sweep once.
     *
     * @return number of lobbies destroyed
     */
    public int triggerCleanup() {
        Instant threshold = Instant.now().minusSeconds(emptyTtlSeconds);

        int destroyed = 0;
        for (Lobby lobby : coordinationService.getLobbies()) {
            if (lobby.destroyIfEmptySince(threshold)) {
                destroyed++;
            }
        }

        if (destroyed > 0) {
            log.info("Destroyed {} lobby(ies) empty for more than {}s", destroyed, emptyTtlSeconds);
        } else {
            log.debug("No abandoned lobbies to clean up");
        }
        return destroyed;
    }
}
